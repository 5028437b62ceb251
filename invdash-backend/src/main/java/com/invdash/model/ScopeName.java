package com.invdash.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Logical grouping of inventory data requested from a provider.
 */
public enum ScopeName {
    VMS("vms"),
    HOSTS("hosts");

    private final String value;

    ScopeName(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parses a scope name case-insensitively.
     *
     * @param raw raw scope name, e.g. {@code "VMS"} or {@code "hosts"}
     * @return parsed scope
     * @throws IllegalArgumentException if the name is blank or unknown
     */
    @JsonCreator
    public static ScopeName parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("scope is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ScopeName scope : values()) {
            if (scope.value.equals(normalized)) {
                return scope;
            }
        }
        throw new IllegalArgumentException("Unknown scope: " + raw);
    }
}
