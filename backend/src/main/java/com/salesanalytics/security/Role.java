package com.salesanalytics.security;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Roles carried in the {@code role} claim of access tokens.
 */
public enum Role {

    ADMIN("admin"),
    MANAGER("manager"),
    AGENT("agent");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Spring Security authority name, e.g. {@code ROLE_MANAGER}.
     */
    public String authority() {
        return "ROLE_" + name();
    }

    /**
     * Parses a claim value case-insensitively.
     *
     * @param value the raw claim value, may be null
     * @return the role, or empty if the value is not a known role
     */
    public static Optional<Role> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(role -> role.value.equalsIgnoreCase(normalized))
                .findFirst();
    }
}
