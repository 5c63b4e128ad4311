package com.sporehub.backend.auth.token;

import com.sporehub.backend.auth.model.Identity;
import com.sporehub.backend.auth.model.Role;

import java.time.Instant;

/**
 * Decoded and verified payload of an access token.
 */
public record TokenClaims(
        String subjectId,
        String email,
        Role role,
        Instant issuedAt,
        Instant expiresAt
) {
    public Identity toIdentity() {
        return new Identity(subjectId, email, role);
    }
}
