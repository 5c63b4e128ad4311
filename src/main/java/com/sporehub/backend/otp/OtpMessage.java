package com.sporehub.backend.otp;

public record OtpMessage(String subject, String htmlBody, String textBody) {
}
