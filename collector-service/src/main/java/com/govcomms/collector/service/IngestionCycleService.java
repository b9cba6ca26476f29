package com.govcomms.collector.service;

import com.govcomms.collector.config.CollectorProperties;
import com.govcomms.collector.dto.AssetScope;
import com.govcomms.collector.dto.CandidateItem;
import com.govcomms.collector.dto.IngestionSummary;
import com.govcomms.collector.dto.RenderOutcome;
import com.govcomms.collector.dto.RunOptions;
import com.govcomms.collector.dto.SourceCycleResult;
import com.govcomms.collector.entity.IngestionCycle;
import com.govcomms.collector.entity.IngestionCycle.CycleState;
import com.govcomms.collector.entity.Source;
import com.govcomms.collector.repository.IngestionCycleRepository;
import com.govcomms.collector.service.fetch.FetchContext;
import com.govcomms.collector.service.fetch.ItemFetcherRegistry;
import com.govcomms.collector.service.render.AssetRenderService;
import com.govcomms.collector.store.ItemStore;
import com.govcomms.collector.store.SourceRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Runs the fetch, ingest, staleness check and render cycle of a single source.
 *
 * <p>State machine:
 * <pre>
 * IDLE -> FETCHING -> (FETCH_FAILED | FETCH_OK) -> INGESTING -> (INGEST_OK | INGEST_FAILED)
 *      -> STALENESS_CHECK -> (RENDER_SKIPPED | RENDERING -> RENDER_OK | RENDER_FAILED) -> IDLE
 * </pre>
 * Fetching and ingesting run as one pipeline over the lazy candidate stream; the fetch and
 * ingest states are settled once the stream is drained. A source whose exclusion token is held
 * by another cycle ends as SKIPPED_BUSY without side effects.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionCycleService {

    private final SourceRegistry sourceRegistry;
    private final ItemStore itemStore;
    private final ItemFetcherRegistry fetcherRegistry;
    private final IngestionService ingestionService;
    private final AssetRenderService assetRenderService;
    private final SourceLockRegistry lockRegistry;
    private final IngestionCycleRepository cycleRepository;
    private final CollectorProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private Counter ingestedCounter;
    private Counter skippedCounter;
    private Counter failedCyclesCounter;

    @PostConstruct
    public void initMetrics() {
        ingestedCounter = Counter.builder("collector.items.ingested")
                .description("Number of new items stored")
                .register(meterRegistry);

        skippedCounter = Counter.builder("collector.items.skipped")
                .description("Number of fetched items skipped as known or malformed")
                .register(meterRegistry);

        failedCyclesCounter = Counter.builder("collector.cycles.failed")
                .description("Number of source cycles ending in a failure state")
                .register(meterRegistry);
    }

    public SourceCycleResult runCycle(Source source, RunOptions options) {
        long sourceId = source.getId();
        if (!lockRegistry.tryAcquire(sourceId)) {
            log.info("Source #{} ({}) is busy in another cycle, skipping", sourceId, source.getName());
            return new SourceCycleResult(sourceId, source.getName(), CycleState.SKIPPED_BUSY,
                    0, 0, 0, null, List.of(CycleState.SKIPPED_BUSY));
        }

        Tracker tracker = new Tracker(IngestionCycle.builder()
                .sourceId(sourceId)
                .dryRun(options.isDryRun())
                .startedAt(LocalDateTime.now(clock))
                .build());
        IngestionSummary summary = null;
        try {
            log.info("Source #{} | {} ({}) cycle started{}", sourceId, source.getName(), source.getKind().getValue(),
                    options.isDryRun() ? " [dry-run]" : "");
            persist(tracker.cycle);
            if (!options.isDryRun()) {
                sourceRegistry.markChecked(sourceId, LocalDateTime.now(clock));
            }

            tracker.enter(CycleState.FETCHING);
            Stream<CandidateItem> candidates = fetcherRegistry.forKind(source.getKind())
                    .fetchCandidates(source, fetchContext(source, options));
            summary = ingestionService.ingest(source, candidates, options.isDryRun());
            tracker.record(summary);

            switch (summary.outcome()) {
                case FETCH_FAILED -> tracker.fail(CycleState.FETCH_FAILED, summary.lastError());
                case STORE_FAILED -> {
                    tracker.enter(CycleState.INGESTING);
                    tracker.fail(CycleState.INGEST_FAILED, summary.lastError());
                }
                case COMPLETED -> {
                    tracker.enter(CycleState.FETCH_OK);
                    tracker.enter(CycleState.INGESTING);
                    tracker.enter(CycleState.INGEST_OK);
                    if (!options.isDryRun()) {
                        LocalDateTime now = LocalDateTime.now(clock);
                        sourceRegistry.markSuccess(sourceId, now);
                        sourceRegistry.refreshSummary(sourceId);
                        render(sourceId, options, tracker);
                    }
                }
            }
        } catch (RuntimeException e) {
            log.error("Source #{} cycle aborted in state {}", sourceId, tracker.current(), e);
            tracker.fail(failureFor(tracker.current()), e.getMessage());
        } finally {
            lockRegistry.release(sourceId);
            tracker.cycle.setCompletedAt(LocalDateTime.now(clock));
            persist(tracker.cycle);
        }

        CycleState finalState = tracker.current();
        if (finalState.isFailure()) {
            failedCyclesCounter.increment();
        }
        if (summary != null) {
            if (!options.isDryRun()) {
                ingestedCounter.increment(summary.newCount());
            }
            skippedCounter.increment(summary.skippedCount());
        }
        tracker.transitions.add(CycleState.IDLE);

        log.info("Source #{} | {} cycle finished: state={}, new={}, skipped={}, warnings={}",
                sourceId, source.getName(), finalState, tracker.cycle.getNewCount(),
                tracker.cycle.getSkippedCount(), tracker.cycle.getWarningCount());
        return new SourceCycleResult(sourceId, source.getName(), finalState,
                tracker.cycle.getNewCount(), tracker.cycle.getSkippedCount(), tracker.cycle.getWarningCount(),
                tracker.cycle.getErrorMessage(), List.copyOf(tracker.transitions));
    }

    /**
     * Remove completed cycle rows older than the retention period.
     */
    @Transactional
    public int purgeCompletedCycles() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(properties.getCycles().getRetentionDays());
        int deleted = cycleRepository.deleteCompletedBefore(cutoff);
        if (deleted > 0) {
            log.info("Purged {} ingestion cycles completed before {}", deleted, cutoff);
        }
        return deleted;
    }

    private void render(long sourceId, RunOptions options, Tracker tracker) {
        tracker.enter(CycleState.STALENESS_CHECK);
        boolean catchUpMissing = options.isCatchUpMissing() || properties.getRender().isCatchUpMissing();
        RenderOutcome outcome;
        try {
            outcome = assetRenderService.renderScope(AssetScope.source(sourceId), catchUpMissing);
        } catch (RuntimeException e) {
            log.error("Source #{} rendering aborted", sourceId, e);
            tracker.enter(CycleState.RENDERING);
            tracker.fail(CycleState.RENDER_FAILED, e.getMessage());
            return;
        }
        if (outcome.isSkipped()) {
            tracker.enter(CycleState.RENDER_SKIPPED);
            return;
        }
        tracker.enter(CycleState.RENDERING);
        if (outcome.isFailed()) {
            tracker.fail(CycleState.RENDER_FAILED, outcome.error());
        } else {
            tracker.enter(CycleState.RENDER_OK);
        }
    }

    private static CycleState failureFor(CycleState current) {
        return switch (current) {
            case IDLE, FETCHING -> CycleState.FETCH_FAILED;
            case STALENESS_CHECK, RENDERING -> CycleState.RENDER_FAILED;
            default -> CycleState.INGEST_FAILED;
        };
    }

    private FetchContext fetchContext(Source source, RunOptions options) {
        long sourceId = source.getId();
        int maxItems = options.getMaxItems() > 0 ? options.getMaxItems() : properties.getFetch().getMaxItems();
        boolean uploadsOnly = options.getUploadsOnly() != null
                ? options.getUploadsOnly()
                : properties.getVideo().isUploadsOnly();
        return FetchContext.builder()
                .isKnown(externalId -> itemStore.exists(sourceId, externalId))
                .since(options.getSince())
                .maxItems(maxItems)
                .retryPolicy(properties.toRetryPolicy())
                .startUrl(options.hasNarrowingFilter() ? options.getStartUrl() : null)
                .uploadsOnly(uploadsOnly)
                .build();
    }

    private void persist(IngestionCycle cycle) {
        try {
            cycleRepository.save(cycle);
        } catch (DataAccessException e) {
            // the audit row is best effort, the cycle result is still reported
            log.warn("Could not persist ingestion cycle of source #{}: {}", cycle.getSourceId(), e.getMessage());
        }
    }

    /**
     * Keeps the audit row and the ordered list of visited states in step.
     */
    private static final class Tracker {

        private final IngestionCycle cycle;
        private final List<CycleState> transitions = new ArrayList<>();

        Tracker(IngestionCycle cycle) {
            this.cycle = cycle;
            transitions.add(CycleState.IDLE);
        }

        void enter(CycleState state) {
            cycle.setState(state);
            transitions.add(state);
        }

        void fail(CycleState state, String error) {
            enter(state);
            cycle.setErrorMessage(error);
        }

        void record(IngestionSummary summary) {
            cycle.setNewCount(summary.newCount());
            cycle.setSkippedCount(summary.skippedCount());
            cycle.setWarningCount(summary.warningCount());
        }

        CycleState current() {
            return cycle.getState();
        }
    }
}
