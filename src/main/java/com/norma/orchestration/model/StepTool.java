package com.norma.orchestration.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StepTool {
    SEARCH("search"),
    CALCULATE("calculate"),
    OTHER("other");

    private final String wireName;

    StepTool(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Maps model output onto a tool. Unknown names become {@link #OTHER}, which no handler
     * serves, so plan validation rejects them.
     */
    @JsonCreator
    public static StepTool from(String value) {
        if (value == null) {
            return OTHER;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "search", "search_documents", "document_search" -> SEARCH;
            case "calculate", "calculation", "calculator" -> CALCULATE;
            default -> OTHER;
        };
    }
}
