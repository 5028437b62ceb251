package com.invdash.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Durable, cache-level view of a host's health inside a snapshot.
 */
public enum SnapshotHostState {
    OK("ok"),
    ERROR("error"),
    TIMEOUT("timeout"),
    PENDING("pending"),
    SKIPPED_COOLDOWN("skipped_cooldown"),
    STALE("stale");

    private final String value;

    SnapshotHostState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SnapshotHostState fromValue(String value) {
        for (SnapshotHostState state : values()) {
            if (state.value.equalsIgnoreCase(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown snapshot host state: " + value);
    }
}
