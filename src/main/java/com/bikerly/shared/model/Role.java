package com.bikerly.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of account roles. Stored and serialized by their lower-case value.
 * No hierarchy: ADMIN does not satisfy a RIDER requirement or vice versa.
 */
public enum Role {
    RIDER("rider"),
    ADMIN("admin");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parses a stored or transmitted role value.
     * @throws IllegalArgumentException for anything outside the known set
     */
    @JsonCreator
    public static Role fromValue(String value) {
        for (Role role : values()) {
            if (role.value.equals(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
