package com.sporehub.backend.identity;

import com.sporehub.backend.auth.model.Role;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Stores {@link Role} by its wire value ({@code farmer}, {@code buyer}, {@code admin}). */
@Converter
public class RoleConverter implements AttributeConverter<Role, String> {

    @Override
    public String convertToDatabaseColumn(Role role) {
        return (role == null) ? null : role.wire();
    }

    @Override
    public Role convertToEntityAttribute(String value) {
        if (value == null) return null;
        return Role.parse(value)
                .orElseThrow(() -> new IllegalStateException("Unknown role in profiles table: " + value));
    }
}
