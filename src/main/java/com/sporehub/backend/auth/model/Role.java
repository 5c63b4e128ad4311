package com.sporehub.backend.auth.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Account roles, as stored in {@code profiles.role} ({@code user_role} enum).
 */
public enum Role {
    FARMER("farmer"),
    BUYER("buyer"),
    ADMIN("admin");

    private final String wire;

    Role(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public static Optional<Role> parse(String raw) {
        if (raw == null) return Optional.empty();
        String v = raw.trim().toLowerCase(Locale.ROOT);
        for (Role r : values()) {
            if (r.wire.equals(v)) return Optional.of(r);
        }
        return Optional.empty();
    }

    @JsonCreator
    static Role fromJson(String raw) {
        return parse(raw).orElseThrow(() -> new IllegalArgumentException("unknown role: " + raw));
    }
}
