package com.govcomms.collector.dto;

import com.govcomms.collector.entity.SourceKind;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Diagnostic view of one source's stored items.
 */
public record SourceHealthReport(
        Long sourceId,
        String name,
        SourceKind kind,
        String url,
        boolean enabled,
        LocalDateTime lastChecked,
        LocalDateTime lastSuccess,
        long totalItems,
        long itemsWithTitle,
        long itemsMissingDate,
        LocalDateTime firstPublishedAt,
        LocalDateTime lastPublishedAt,
        List<LatestItem> latest
) {
    public record LatestItem(LocalDateTime publishedAt, String title, String externalId) {
    }
}
