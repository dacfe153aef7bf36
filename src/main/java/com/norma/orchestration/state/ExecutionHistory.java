package com.norma.orchestration.state;

import com.norma.orchestration.model.ExecutionHistoryEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only record of dispatched steps with their results and verdicts.
 */
public class ExecutionHistory {

    private final List<ExecutionHistoryEntry> entries = new ArrayList<>();

    void append(ExecutionHistoryEntry entry) {
        entries.add(entry);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int nextSequence() {
        return entries.size() + 1;
    }

    public List<ExecutionHistoryEntry> entries() {
        return List.copyOf(entries);
    }

    /**
     * The most recent {@code count} entries, oldest first.
     */
    public List<ExecutionHistoryEntry> latest(int count) {
        if (count <= 0) {
            return List.of();
        }
        int from = Math.max(0, entries.size() - count);
        return List.copyOf(entries.subList(from, entries.size()));
    }
}
