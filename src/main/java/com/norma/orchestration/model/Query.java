package com.norma.orchestration.model;

public record Query(String text) {

    public Query {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Query text must not be blank");
        }
        text = text.trim();
    }
}
