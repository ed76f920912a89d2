package com.salesdw.model;

import java.util.List;

/**
 * Result of one layer entry point: every per-table log row written under the batch tag.
 */
public record LayerRunResult(
    Layer layer,
    String batchTag,
    List<LoadLogEntry> entries,
    long durationMs
) {

    public boolean hasErrors() {
        return entries.stream().anyMatch(e -> !e.isSuccess());
    }

    public List<String> failedTables() {
        return entries.stream()
                .filter(e -> !e.isSuccess())
                .map(LoadLogEntry::tableName)
                .toList();
    }
}
