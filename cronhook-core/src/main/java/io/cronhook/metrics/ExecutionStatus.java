package io.cronhook.metrics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ExecutionStatus {
    SUCCESS("success"),
    FAILED("failed");

    private final String value;

    ExecutionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ExecutionStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "success" -> SUCCESS;
            case "failed" -> FAILED;
            default -> throw new IllegalArgumentException("Unknown execution status: " + value);
        };
    }
}
