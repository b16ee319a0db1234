package com.storefront.authservice.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Flat role set. The only implication is SUPERADMIN ⊇ ADMIN, applied by the authorization rules.
 */
public enum UserRole {
    USER,
    ADMIN,
    SUPERADMIN;

    /** Lower-case name used in tokens and JSON. */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Spring Security authority, e.g. {@code ROLE_ADMIN}. */
    public String authority() {
        return "ROLE_" + name();
    }

    public static Optional<UserRole> fromWire(String value) {
        if (value == null) return Optional.empty();
        String v = value.trim();
        return Arrays.stream(values())
                .filter(r -> r.name().equalsIgnoreCase(v))
                .findFirst();
    }

    @JsonCreator
    static UserRole parse(String value) {
        return fromWire(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + value));
    }
}
