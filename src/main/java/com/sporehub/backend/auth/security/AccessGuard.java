package com.sporehub.backend.auth.security;

import com.sporehub.backend.admission.AdmissionService;
import com.sporehub.backend.auth.model.Identity;
import com.sporehub.backend.auth.model.Role;
import com.sporehub.backend.auth.token.TokenClaims;
import com.sporehub.backend.auth.token.TokenService;
import com.sporehub.backend.common.web.ForbiddenException;
import com.sporehub.backend.common.web.UnauthenticatedException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.function.Function;

/**
 * Ordered request gate:
 * 1. admission (429)
 * 2. bearer extraction, header must be exactly {@code "Bearer " + token} (401)
 * 3. token verification (401)
 * 4. role check when the operation declares roles (403)
 * 5. identity handed to the protected operation
 * Each step stops the chain on failure.
 */
@Component
@RequiredArgsConstructor
public class AccessGuard {

    static final String BEARER_PREFIX = "Bearer ";

    private final AdmissionService admission;
    private final TokenService tokens;

    public Identity authorize(String clientKey, String authorizationHeader, Set<Role> requiredRoles) {
        admission.checkOrThrow(clientKey);

        String token = extractBearer(authorizationHeader);
        TokenClaims claims = tokens.verify(token);

        if (requiredRoles != null && !requiredRoles.isEmpty() && !requiredRoles.contains(claims.role())) {
            throw new ForbiddenException("Insufficient permissions for this action");
        }
        return claims.toIdentity();
    }

    /**
     * Wraps a protected operation: it only runs with the identity of a caller that passed every check.
     */
    public <T> T guard(String clientKey, String authorizationHeader, Set<Role> requiredRoles,
                       Function<Identity, T> operation) {
        Identity identity = authorize(clientKey, authorizationHeader, requiredRoles);
        return operation.apply(identity);
    }

    static String extractBearer(String header) {
        if (header == null || header.isEmpty()) {
            throw new UnauthenticatedException("Authorization header is required");
        }
        if (!header.startsWith(BEARER_PREFIX)) {
            throw new UnauthenticatedException("Invalid authorization format. Use: Bearer <token>");
        }
        String token = header.substring(BEARER_PREFIX.length());
        if (token.isEmpty() || token.contains(" ")) {
            throw new UnauthenticatedException("Invalid authorization format. Use: Bearer <token>");
        }
        return token;
    }
}
