package com.norma.orchestration.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record FinalAnswer(
        String text,
        Set<SourceRef> citations,
        List<String> limitations
) {

    public FinalAnswer {
        text = text == null ? "" : text;
        citations = citations == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(citations));
        limitations = limitations == null ? List.of() : List.copyOf(limitations);
    }
}
