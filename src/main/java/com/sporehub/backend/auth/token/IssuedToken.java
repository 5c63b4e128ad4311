package com.sporehub.backend.auth.token;

import java.time.Instant;

public record IssuedToken(String token, Instant issuedAt, Instant expiresAt) {
}
