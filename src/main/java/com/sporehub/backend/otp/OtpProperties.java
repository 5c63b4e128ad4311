package com.sporehub.backend.otp;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "app.otp")
public class OtpProperties {

    /** Number of digits in a generated code. */
    private int codeLength = 6;

    /** Upper bound on one delivery attempt; the record is kept when it is exceeded. */
    private Duration deliveryTimeout = Duration.ofSeconds(10);

    /** Product name shown in the default templates. */
    private String appName = "Smart Spore Hub";

    private Expiry expiry = new Expiry();

    @Data
    public static class Expiry {
        private Duration login = Duration.ofMinutes(5);
        private Duration passwordReset = Duration.ofMinutes(15);
        private Duration verification = Duration.ofMinutes(30);
        private Duration registration = Duration.ofMinutes(30);
    }

    public Duration expiryFor(OtpPurpose purpose) {
        return switch (purpose) {
            case LOGIN -> expiry.getLogin();
            case PASSWORD_RESET -> expiry.getPasswordReset();
            case VERIFICATION -> expiry.getVerification();
            case REGISTRATION -> expiry.getRegistration();
        };
    }
}
