package com.sporehub.backend.otp.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * {@code subject}/{@code htmlTemplate}/{@code textTemplate} are optional; when {@code htmlTemplate}
 * is present the caller's templates are rendered instead of the defaults.
 */
public record OtpIssueRequest(
        @NotBlank @Email @Size(max = 320) String email,
        @NotBlank String purpose,
        @Size(max = 200) String subject,
        @Size(max = 20_000) String htmlTemplate,
        @Size(max = 5_000) String textTemplate
) {
    public boolean hasTemplate() {
        return htmlTemplate != null && !htmlTemplate.isBlank();
    }
}
