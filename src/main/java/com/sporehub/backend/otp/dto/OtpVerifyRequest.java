package com.sporehub.backend.otp.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record OtpVerifyRequest(
        @NotBlank @Email @Size(max = 320) String email,
        @NotBlank String purpose,
        @NotBlank @Size(max = 16) String code
) {}
