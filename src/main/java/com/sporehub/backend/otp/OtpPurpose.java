package com.sporehub.backend.otp;

import com.fasterxml.jackson.annotation.JsonValue;
import com.sporehub.backend.common.web.InvalidRequestException;

import java.util.Locale;

/**
 * Why a one-time code was issued. Each purpose has its own validity window (see {@link OtpProperties}).
 */
public enum OtpPurpose {
    LOGIN("login", "Login"),
    PASSWORD_RESET("password-reset", "Password Reset"),
    VERIFICATION("verification", "Email Verification"),
    REGISTRATION("registration", "Registration");

    private final String wire;
    private final String label;

    OtpPurpose(String wire, String label) {
        this.wire = wire;
        this.label = label;
    }

    @JsonValue
    public String wire() { return wire; }

    /** Human readable name substituted for {@code {{purpose}}} in templates. */
    public String label() { return label; }

    /**
     * Accepts the wire value ({@code password-reset}) or the constant name ({@code PASSWORD_RESET}).
     */
    public static OtpPurpose parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidRequestException("purpose is required");
        }
        String v = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (OtpPurpose p : values()) {
            if (p.wire.equals(v)) return p;
        }
        throw new InvalidRequestException("unknown purpose: " + raw.trim());
    }
}
