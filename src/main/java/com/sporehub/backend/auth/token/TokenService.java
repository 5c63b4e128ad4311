package com.sporehub.backend.auth.token;

import com.sporehub.backend.auth.config.AuthProperties;
import com.sporehub.backend.auth.model.Role;
import com.sporehub.backend.common.web.UnauthenticatedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * Issues and verifies HS256 access tokens.
 * Every verification failure surfaces as the same {@link UnauthenticatedException};
 * the specific reason only goes to the debug log.
 */
@Slf4j
@Service
public class TokenService {

    public static final String INVALID_TOKEN = "Invalid or expired token";

    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLE = "role";

    private static final int MIN_SECRET_BYTES = 32;

    private final SecretKey key;
    private final Duration accessTtl;
    private final String issuer;
    private final Clock clock;

    public TokenService(AuthProperties props, Clock clock) {
        String secret = props.getJwtSecret();
        byte[] raw = (secret == null) ? new byte[0] : secret.getBytes(StandardCharsets.UTF_8);
        if (raw.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                    "app.auth.jwt-secret must be at least " + MIN_SECRET_BYTES + " bytes. " +
                    "Set env JWT_SECRET."
            );
        }
        if (props.getAccessTtl() == null || props.getAccessTtl().isNegative() || props.getAccessTtl().isZero()) {
            throw new IllegalStateException("app.auth.access-ttl must be positive");
        }
        this.key = Keys.hmacShaKeyFor(raw);
        this.accessTtl = props.getAccessTtl();
        this.issuer = props.getIssuer();
        this.clock = clock;
    }

    public IssuedToken issue(String subjectId, String email, Role role) {
        if (subjectId == null || subjectId.isBlank()) throw new IllegalArgumentException("subjectId required");
        if (email == null || email.isBlank()) throw new IllegalArgumentException("email required");
        if (role == null) throw new IllegalArgumentException("role required");

        // JWT dates carry second precision
        Instant now = Instant.ofEpochSecond(clock.instant().getEpochSecond());
        Instant exp = now.plus(accessTtl);

        String token = Jwts.builder()
                .issuer(issuer)
                .subject(subjectId)
                .claim(CLAIM_EMAIL, email)
                .claim(CLAIM_ROLE, role.wire())
                .issuedAt(Date.from(now))
                .expiration(Date.from(exp))
                .signWith(key)
                .compact();

        return new IssuedToken(token, now, exp);
    }

    public TokenClaims verify(String token) {
        if (token == null || token.isBlank()) throw new UnauthenticatedException(INVALID_TOKEN);

        try {
            Claims c = Jwts.parser()
                    .verifyWith(key)
                    .requireIssuer(issuer)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            return toClaims(c);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("token rejected: {}", e.getClass().getSimpleName());
            throw new UnauthenticatedException(INVALID_TOKEN);
        }
    }

    private static TokenClaims toClaims(Claims c) {
        String subject = c.getSubject();
        String email = c.get(CLAIM_EMAIL, String.class);
        Optional<Role> role = Role.parse(c.get(CLAIM_ROLE, String.class));
        if (subject == null || subject.isBlank() || email == null || email.isBlank()
                || role.isEmpty() || c.getExpiration() == null) {
            log.debug("token rejected: missing or malformed claims");
            throw new UnauthenticatedException(INVALID_TOKEN);
        }

        Instant iat = (c.getIssuedAt() == null) ? null : c.getIssuedAt().toInstant();
        return new TokenClaims(subject, email, role.get(), iat, c.getExpiration().toInstant());
    }
}
