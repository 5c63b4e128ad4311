package com.sporehub.backend.delivery.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record ChatSendRequest(
        @NotBlank @Pattern(regexp = "\\+?[0-9 ()-]{6,24}", message = "must be a phone number") String to,
        @NotBlank @Size(max = 4096) String message
) {}
