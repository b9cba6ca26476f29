package com.govcomms.collector.service;

import com.govcomms.collector.config.CollectorProperties;
import com.govcomms.collector.dto.RenderOutcome;
import com.govcomms.collector.dto.RunOptions;
import com.govcomms.collector.dto.RunReport;
import com.govcomms.collector.dto.SourceCycleResult;
import com.govcomms.collector.entity.Source;
import com.govcomms.collector.entity.SourceKind;
import com.govcomms.collector.service.render.GlobalAssetAggregator;
import com.govcomms.collector.store.SourceRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Entry point of one pipeline run: selects sources, runs their cycles on the ingestion pool,
 * then runs the global aggregation over the committed state.
 */
@Service
@Slf4j
public class IngestionRunService {

    private final SourceRegistry sourceRegistry;
    private final IngestionCycleService cycleService;
    private final GlobalAssetAggregator globalAggregator;
    private final CollectorProperties properties;
    private final Executor ingestionExecutor;
    private final Clock clock;

    public IngestionRunService(SourceRegistry sourceRegistry,
                               IngestionCycleService cycleService,
                               GlobalAssetAggregator globalAggregator,
                               CollectorProperties properties,
                               @Qualifier("ingestionExecutor") Executor ingestionExecutor,
                               Clock clock) {
        this.sourceRegistry = sourceRegistry;
        this.cycleService = cycleService;
        this.globalAggregator = globalAggregator;
        this.properties = properties;
        this.ingestionExecutor = ingestionExecutor;
        this.clock = clock;
    }

    /**
     * Options of a scheduled run, derived from configuration.
     */
    public RunOptions defaultOptions() {
        Set<SourceKind> kinds = EnumSet.noneOf(SourceKind.class);
        if (properties.getBlog().isEnabled()) {
            kinds.add(SourceKind.BLOG);
        }
        if (properties.getVideo().isEnabled()) {
            kinds.add(SourceKind.VIDEO);
        }
        return RunOptions.builder()
                .kinds(kinds)
                .maxItems(properties.getFetch().getMaxItems())
                .catchUpMissing(properties.getRender().isCatchUpMissing())
                .renderGlobal(properties.getScheduling().isRenderGlobal())
                .build();
    }

    public RunReport runOnce(RunOptions options) {
        LocalDateTime startedAt = LocalDateTime.now(clock);
        List<Source> sources = selectSources(options);
        log.info("Run started: {} sources selected (kinds={}, dryRun={})",
                sources.size(), options.getKinds(), options.isDryRun());

        List<CompletableFuture<SourceCycleResult>> futures = sources.stream()
                .map(source -> CompletableFuture.supplyAsync(
                        () -> cycleService.runCycle(source, options), ingestionExecutor))
                .toList();
        List<SourceCycleResult> results = futures.stream()
                .map(CompletableFuture::join)
                .toList();

        RenderOutcome global = null;
        if (options.isRenderGlobal() && !options.isDryRun()) {
            global = globalAggregator.aggregate(options.isCatchUpMissing());
        }
        if (!options.isDryRun()) {
            try {
                cycleService.purgeCompletedCycles();
            } catch (DataAccessException e) {
                log.warn("Purging old ingestion cycles failed: {}", e.getMessage());
            }
        }

        RunReport report = new RunReport(startedAt, LocalDateTime.now(clock), results, global);
        log.info("Run finished: sources={}, new={}, failed={}, global={}",
                results.size(), report.totalNew(), report.failedCount(),
                global == null ? "not run" : global.isFailed() ? "failed" : global.isSkipped() ? "skipped" : global.rendered());
        return report;
    }

    List<Source> selectSources(RunOptions options) {
        LocalDate today = LocalDate.now(clock);
        boolean recheckBlogs = options.isForce() || options.hasNarrowingFilter();

        return sourceRegistry.listEnabledSources().stream()
                .filter(source -> options.getKinds() == null || options.getKinds().contains(source.getKind()))
                .filter(source -> options.getSourceId() == null || options.getSourceId().equals(source.getId()))
                .filter(source -> options.getHost() == null || options.getHost().isBlank()
                        || source.host().equals(options.getHost().trim().toLowerCase(Locale.ROOT)))
                .filter(source -> options.getChannelId() == null || options.getChannelId().isBlank()
                        || options.getChannelId().equals(source.getChannelId()))
                .filter(source -> {
                    if (source.getKind() == SourceKind.BLOG && !recheckBlogs && source.wasCheckedOn(today)) {
                        log.debug("Source #{} already checked today, skipping", source.getId());
                        return false;
                    }
                    return true;
                })
                .toList();
    }
}
