package com.invdash.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum JobState {
    PENDING("pending"),
    RUNNING("running"),
    DONE("done"),
    ERROR("error");

    private final String value;

    JobState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }

    @JsonCreator
    public static JobState fromValue(String value) {
        for (JobState state : values()) {
            if (state.value.equalsIgnoreCase(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown job state: " + value);
    }
}
