package com.sporehub.backend.delivery.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record MailSendRequest(
        @NotBlank @Email @Size(max = 320) String to,
        @NotBlank @Size(max = 200) String subject,
        @NotBlank @Size(max = 50_000) String html,
        @Size(max = 20_000) String text
) {}
