package com.sporehub.backend.otp;

import com.sporehub.backend.common.crypto.Sha256;

import java.time.Instant;

/**
 * The active code for one (email, purpose) pair. Only the SHA-256 of the code is kept.
 */
public record OtpRecord(
        String email,
        OtpPurpose purpose,
        String codeHash,
        Instant issuedAt,
        Instant expiresAt
) {
    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    public boolean matches(String presentedCode) {
        if (presentedCode == null) return false;
        return Sha256.equalsHex(codeHash, Sha256.hex(presentedCode.trim()));
    }
}
