package com.govcomms.collector.dto;

/**
 * Outcome of merging one fetch stream into the item store.
 */
public record IngestionSummary(
        int newCount,
        int skippedCount,
        int warningCount,
        String lastError,
        Outcome outcome
) {
    public enum Outcome {
        COMPLETED,
        FETCH_FAILED,
        STORE_FAILED
    }

    public boolean isCompleted() {
        return outcome == Outcome.COMPLETED;
    }
}
