package com.sporehub.backend.otp.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sporehub.backend.auth.model.Identity;
import com.sporehub.backend.auth.token.IssuedToken;
import com.sporehub.backend.otp.OtpPurpose;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OtpVerifyResponse(
        OtpPurpose purpose,
        boolean verified,
        String accessToken,
        String tokenType,
        Long accessExpiresInSec,
        Identity user
) {
    public static OtpVerifyResponse verified(OtpPurpose purpose) {
        return new OtpVerifyResponse(purpose, true, null, null, null, null);
    }

    public static OtpVerifyResponse loggedIn(Identity identity, IssuedToken token) {
        long ttl = token.expiresAt().getEpochSecond() - token.issuedAt().getEpochSecond();
        return new OtpVerifyResponse(OtpPurpose.LOGIN, true, token.token(), "Bearer", ttl, identity);
    }
}
