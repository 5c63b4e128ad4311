package com.sporehub.backend.auth.security;

import com.sporehub.backend.admission.AdmissionProperties;
import com.sporehub.backend.admission.AdmissionService;
import com.sporehub.backend.admission.InMemoryAdmissionTracker;
import com.sporehub.backend.auth.config.AuthProperties;
import com.sporehub.backend.auth.model.Identity;
import com.sporehub.backend.auth.model.Role;
import com.sporehub.backend.auth.token.TokenService;
import com.sporehub.backend.common.web.ForbiddenException;
import com.sporehub.backend.common.web.RateLimitedException;
import com.sporehub.backend.common.web.UnauthenticatedException;
import com.sporehub.backend.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccessGuardTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T08:00:00Z"));
    private TokenService tokens;
    private AccessGuard guard;

    @BeforeEach
    void setUp() {
        AdmissionProperties props = new AdmissionProperties();
        props.setRequestsPerMinute(3);
        AdmissionService admission = new AdmissionService(new InMemoryAdmissionTracker(props), props, clock);
        AuthProperties auth = new AuthProperties();
        auth.setJwtSecret("guard-test-secret-guard-test-secret-0123");
        tokens = new TokenService(auth, clock);
        guard = new AccessGuard(admission, tokens);
    }

    private String bearer(Role role) {
        return "Bearer " + tokens.issue("sub-1", "user@example.com", role).token();
    }

    @Test
    void valid_token_and_role_yields_identity() {
        Identity id = guard.authorize("1.1.1.1", bearer(Role.ADMIN), EnumSet.of(Role.ADMIN));

        assertThat(id).isEqualTo(new Identity("sub-1", "user@example.com", Role.ADMIN));
    }

    @Test
    void no_required_roles_accepts_any_role() {
        assertThat(guard.authorize("1.1.1.1", bearer(Role.BUYER), Set.of()).role()).isEqualTo(Role.BUYER);
    }

    @Test
    void missing_header_is_unauthenticated() {
        assertThatThrownBy(() -> guard.authorize("1.1.1.1", null, Set.of()))
                .isInstanceOf(UnauthenticatedException.class)
                .hasMessage("Authorization header is required");
    }

    @Test
    void malformed_header_is_unauthenticated() {
        for (String h : new String[]{"Token abc", "Bearer ", "bearer abc", "Bearer a b", "Basic dXNlcjpwYXNz"}) {
            assertThatThrownBy(() -> guard.authorize("1.1.1.1", h, Set.of()))
                    .as(h)
                    .isInstanceOf(UnauthenticatedException.class)
                    .hasMessage("Invalid authorization format. Use: Bearer <token>");
        }
    }

    @Test
    void wrong_role_is_forbidden_and_operation_does_not_run() {
        AtomicBoolean ran = new AtomicBoolean(false);

        assertThatThrownBy(() -> guard.guard("1.1.1.1", bearer(Role.FARMER), EnumSet.of(Role.ADMIN), id -> {
            ran.set(true);
            return id;
        })).isInstanceOf(ForbiddenException.class);

        assertThat(ran).isFalse();
    }

    @Test
    void admission_runs_before_token_checks() {
        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> guard.authorize("9.9.9.9", "garbage", Set.of()))
                    .isInstanceOf(UnauthenticatedException.class);
        }
        // a valid token does not help once the client is over its limit
        assertThatThrownBy(() -> guard.authorize("9.9.9.9", bearer(Role.ADMIN), Set.of()))
                .isInstanceOf(RateLimitedException.class);
    }

    @Test
    void guard_passes_identity_to_operation() {
        String result = guard.guard("1.1.1.1", bearer(Role.BUYER), EnumSet.of(Role.BUYER, Role.ADMIN),
                id -> "hello " + id.email());

        assertThat(result).isEqualTo("hello user@example.com");
    }
}
