package com.govcomms.collector.store;

import java.time.LocalDateTime;

public record ItemSummary(
        long total,
        long withTitle,
        long missingDate,
        LocalDateTime firstPublishedAt,
        LocalDateTime lastPublishedAt
) {
}
