package com.govcomms.collector.service;

import com.govcomms.collector.dto.SourceHealthReport;
import com.govcomms.collector.entity.Item;
import com.govcomms.collector.entity.Source;
import com.govcomms.collector.store.ItemStore;
import com.govcomms.collector.store.ItemSummary;
import com.govcomms.collector.store.SourceRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.NoSuchElementException;

@Service
@RequiredArgsConstructor
public class SourceHealthService {

    static final int LATEST_LIMIT = 10;
    static final int MAX_TITLE_LENGTH = 120;

    private final SourceRegistry sourceRegistry;
    private final ItemStore itemStore;

    public SourceHealthReport report(long sourceId) {
        Source source = sourceRegistry.getSource(sourceId)
                .orElseThrow(() -> new NoSuchElementException("Source not found: " + sourceId));
        ItemSummary summary = itemStore.summary(sourceId);

        List<SourceHealthReport.LatestItem> latest = itemStore.latest(sourceId, LATEST_LIMIT).stream()
                .map(this::toLatestItem)
                .toList();

        return new SourceHealthReport(
                source.getId(),
                source.getName(),
                source.getKind(),
                source.getUrl(),
                source.isEnabledSource(),
                source.getLastChecked(),
                source.getLastSuccess(),
                summary.total(),
                summary.withTitle(),
                summary.missingDate(),
                summary.firstPublishedAt(),
                summary.lastPublishedAt(),
                latest);
    }

    private SourceHealthReport.LatestItem toLatestItem(Item item) {
        return new SourceHealthReport.LatestItem(item.getPublishedAt(), truncate(item.getTitle()), item.getExternalId());
    }

    private static String truncate(String title) {
        if (title == null) {
            return null;
        }
        return title.length() <= MAX_TITLE_LENGTH ? title : title.substring(0, MAX_TITLE_LENGTH);
    }
}
