package com.norma.orchestration.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ResultStatus {
    SUCCESS("success"),
    PARTIAL("partial"),
    NOT_FOUND("not_found"),
    ERROR("error");

    private final String wireName;

    ResultStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isUsable() {
        return this == SUCCESS || this == PARTIAL;
    }

    @JsonCreator
    public static ResultStatus from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("result status is required");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "success" -> SUCCESS;
            case "partial" -> PARTIAL;
            case "not_found", "notfound", "info_not_found" -> NOT_FOUND;
            case "error", "failure" -> ERROR;
            default -> throw new IllegalArgumentException("Unknown result status: " + value);
        };
    }
}
