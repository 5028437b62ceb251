package com.invdash.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per-host state inside a refresh job.
 *
 * <p>{@code pending -> running -> ok|error|timeout}; {@code skipped_cooldown} is entered directly
 * from {@code pending}. Terminal states never change.
 */
public enum HostJobState {
    PENDING("pending"),
    RUNNING("running"),
    OK("ok"),
    ERROR("error"),
    TIMEOUT("timeout"),
    SKIPPED_COOLDOWN("skipped_cooldown");

    private final String value;

    HostJobState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == OK || this == ERROR || this == TIMEOUT || this == SKIPPED_COOLDOWN;
    }

    public boolean isFailure() {
        return this == ERROR || this == TIMEOUT;
    }

    public boolean canTransitionTo(HostJobState next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (this == PENDING) {
            return next != PENDING;
        }
        // running
        return next == OK || next == ERROR || next == TIMEOUT;
    }

    @JsonCreator
    public static HostJobState fromValue(String value) {
        for (HostJobState state : values()) {
            if (state.value.equalsIgnoreCase(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown host job state: " + value);
    }
}
