package com.example.smarttask.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskStatus {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed");

    private final String value;

    TaskStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolves the exact wire value, e.g. {@code "in_progress"}. Constant names, other casings and
     * surrounding whitespace are rejected.
     *
     * @throws IllegalArgumentException when nothing matches
     */
    @JsonCreator
    public static TaskStatus fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Task status must not be blank");
        }
        for (TaskStatus status : values()) {
            if (status.value.equals(raw)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unsupported task status: " + raw);
    }
}
