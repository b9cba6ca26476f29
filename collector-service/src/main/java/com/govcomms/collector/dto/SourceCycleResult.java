package com.govcomms.collector.dto;

import com.govcomms.collector.entity.IngestionCycle.CycleState;

import java.util.List;

/**
 * Per-source outcome of one cycle.
 *
 * @param transitions every state the cycle passed through, in order
 */
public record SourceCycleResult(
        Long sourceId,
        String sourceName,
        CycleState finalState,
        int newCount,
        int skippedCount,
        int warningCount,
        String error,
        List<CycleState> transitions
) {
    public boolean isFailed() {
        return finalState.isFailure();
    }
}
