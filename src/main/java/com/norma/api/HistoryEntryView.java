package com.norma.api;

import com.norma.orchestration.model.ExecutionHistoryEntry;

import java.util.Map;

public record HistoryEntryView(
        int sequence,
        int stepNumber,
        String tool,
        String action,
        String resultStatus,
        String sourceDocument,
        Map<String, Object> facts,
        String verdict,
        String reasoning
) {

    public static HistoryEntryView from(ExecutionHistoryEntry entry) {
        return new HistoryEntryView(
                entry.sequence(),
                entry.step().number(),
                entry.step().tool().wireName(),
                entry.step().action(),
                entry.result().status().wireName(),
                entry.result().source() == null ? null : entry.result().source().documentName(),
                entry.result().structuredOutput(),
                entry.decision().verdict().name(),
                entry.decision().reasoning());
    }
}
