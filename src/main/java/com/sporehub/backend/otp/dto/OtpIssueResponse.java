package com.sporehub.backend.otp.dto;

import com.sporehub.backend.otp.OtpPurpose;
import com.sporehub.backend.otp.OtpRecord;

import java.time.Instant;

// the code itself only travels by email
public record OtpIssueResponse(
        String email,
        OtpPurpose purpose,
        Instant expiresAt
) {
    public static OtpIssueResponse from(OtpRecord record) {
        return new OtpIssueResponse(record.email(), record.purpose(), record.expiresAt());
    }
}
