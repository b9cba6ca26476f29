package com.govcomms.collector.dto;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Summary of one {@code runOnce} invocation.
 *
 * @param global global render outcome, {@code null} when global aggregation did not run
 */
public record RunReport(
        LocalDateTime startedAt,
        LocalDateTime completedAt,
        List<SourceCycleResult> results,
        RenderOutcome global
) {
    public int totalNew() {
        return results.stream().mapToInt(SourceCycleResult::newCount).sum();
    }

    public long failedCount() {
        return results.stream().filter(SourceCycleResult::isFailed).count();
    }
}
