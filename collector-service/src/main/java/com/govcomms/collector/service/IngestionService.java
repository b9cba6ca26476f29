package com.govcomms.collector.service;

import com.govcomms.collector.dto.CandidateItem;
import com.govcomms.collector.dto.IngestionSummary;
import com.govcomms.collector.dto.IngestionSummary.Outcome;
import com.govcomms.collector.entity.Item;
import com.govcomms.collector.entity.Source;
import com.govcomms.collector.exception.SourceCycleFailedException;
import com.govcomms.collector.exception.StoreWriteException;
import com.govcomms.collector.store.ItemStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Merges fetched candidates into the item store.
 *
 * Items already stored are never refreshed. A fetch failure mid-stream keeps what was inserted so far.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionService {

    private final ItemStore itemStore;
    private final Clock clock;

    public IngestionSummary ingest(Source source, Stream<CandidateItem> candidates, boolean dryRun) {
        long sourceId = source.getId();
        int newCount = 0;
        int skippedCount = 0;
        int warningCount = 0;
        // dry run: keys that would have been inserted
        Set<String> pending = new HashSet<>();

        try (candidates) {
            Iterator<CandidateItem> it = candidates.iterator();
            while (it.hasNext()) {
                CandidateItem candidate = it.next();

                if (candidate.isMalformed()) {
                    skippedCount++;
                    warningCount++;
                    log.warn("Source #{}: skipping malformed item {}: {}",
                            sourceId, candidate.externalId(), candidate.parseError());
                    continue;
                }
                if (pending.contains(candidate.externalId()) || itemStore.exists(sourceId, candidate.externalId())) {
                    skippedCount++;
                    continue;
                }
                if (dryRun) {
                    pending.add(candidate.externalId());
                    newCount++;
                    log.debug("[dry-run] Source #{}: would insert {}", sourceId, candidate.externalId());
                    continue;
                }
                if (itemStore.insert(toItem(sourceId, candidate))) {
                    newCount++;
                } else {
                    skippedCount++;
                }
            }
        } catch (SourceCycleFailedException e) {
            log.warn("Source #{}: fetch failed after {} new items: {}", sourceId, newCount, e.getMessage());
            return new IngestionSummary(newCount, skippedCount, warningCount, e.getMessage(), Outcome.FETCH_FAILED);
        } catch (StoreWriteException e) {
            log.error("Source #{}: store write failed after {} new items", sourceId, newCount, e);
            return new IngestionSummary(newCount, skippedCount, warningCount, e.getMessage(), Outcome.STORE_FAILED);
        } catch (DataAccessException e) {
            log.error("Source #{}: store lookup failed after {} new items", sourceId, newCount, e);
            return new IngestionSummary(newCount, skippedCount, warningCount, e.getMessage(), Outcome.STORE_FAILED);
        } catch (RuntimeException e) {
            log.error("Source #{}: candidate stream aborted after {} new items", sourceId, newCount, e);
            return new IngestionSummary(newCount, skippedCount, warningCount, e.getMessage(), Outcome.FETCH_FAILED);
        }

        return new IngestionSummary(newCount, skippedCount, warningCount, null, Outcome.COMPLETED);
    }

    private Item toItem(long sourceId, CandidateItem candidate) {
        return Item.builder()
                .sourceId(sourceId)
                .externalId(candidate.externalId())
                .title(candidate.title())
                .publishedAt(candidate.publishedAt())
                .fetchedAt(LocalDateTime.now(clock))
                .previousUrl(candidate.previousUrl())
                .nextUrl(candidate.nextUrl())
                .discoveredVia(candidate.discoveredVia())
                .durationSeconds(candidate.durationSeconds())
                .build();
    }
}
