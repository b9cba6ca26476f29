package com.govcomms.collector.service.render;

import com.govcomms.collector.config.CollectorProperties;
import com.govcomms.collector.dto.AssetKind;
import com.govcomms.collector.dto.AssetScope;
import com.govcomms.collector.dto.AssetSignal;
import com.govcomms.collector.dto.DailyAverage;
import com.govcomms.collector.dto.MonthlyCount;
import com.govcomms.collector.dto.RenderOutcome;
import com.govcomms.collector.entity.Item;
import com.govcomms.collector.exception.RenderException;
import com.govcomms.collector.service.StalenessDetector;
import com.govcomms.collector.store.AssetStore;
import com.govcomms.collector.store.ItemStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Regenerates the stale assets of one scope.
 *
 * Only stale kinds are rendered. Each artifact is rendered from the raw items of the scope and
 * recorded together with the signal read before the items were loaded, so items arriving during
 * the render leave the asset stale for the next pass.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssetRenderService {

    private final ItemStore itemStore;
    private final AssetStore assetStore;
    private final StalenessDetector stalenessDetector;
    private final AssetRenderer renderer;
    private final ChartGenerationService chartGenerationService;
    private final CollectorProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private Counter renderedCounter;

    @PostConstruct
    public void initMetrics() {
        renderedCounter = Counter.builder("collector.assets.rendered")
                .description("Number of asset artifacts regenerated")
                .register(meterRegistry);
    }

    public RenderOutcome renderScope(AssetScope scope, boolean catchUpMissing) {
        try {
            AssetSignal signal = itemStore.maxSignal(scope);
            List<AssetKind> stale = new ArrayList<>();
            for (AssetKind kind : AssetKind.values()) {
                if (stalenessDetector.isStale(scope, kind, signal, catchUpMissing)) {
                    stale.add(kind);
                }
            }
            if (stale.isEmpty()) {
                log.info("{}: assets up to date (items={}, latest={}), render skipped",
                        scope, signal.itemCount(), signal.maxTimestamp());
                return RenderOutcome.skipped(scope);
            }

            List<Item> items = itemStore.itemsFor(scope);
            LocalDateTime generatedAt = LocalDateTime.now(clock);
            for (AssetKind kind : stale) {
                renderKind(scope, kind, items, generatedAt, signal);
                renderedCounter.increment();
            }
            log.info("{}: rendered {} from {} items", scope, stale, items.size());
            return new RenderOutcome(scope, List.copyOf(stale), null);
        } catch (RenderException e) {
            log.error("{}: render failed", scope, e);
            return RenderOutcome.failed(scope, e.getMessage());
        } catch (DataAccessException e) {
            log.error("{}: could not read items for render", scope, e);
            return RenderOutcome.failed(scope, e.getMessage());
        }
    }

    private void renderKind(AssetScope scope, AssetKind kind, List<Item> items,
                            LocalDateTime generatedAt, AssetSignal signal) {
        CollectorProperties.Render config = properties.getRender();
        switch (kind) {
            case MONTHLY_COUNTS -> {
                List<MonthlyCount> counts = renderer.monthlyCounts(items);
                if (config.isChartsEnabled()) {
                    writeChart(scope, kind, () -> chartGenerationService.generateMonthlyChart(
                            chartTitle(scope, "Items per month"), counts));
                }
                assetStore.writeArtifact(scope, kind, counts, generatedAt, signal);
            }
            case ROLLING_AVERAGE -> {
                List<DailyAverage> averages = renderer.rollingAverage(items, config.getRollingDays());
                if (config.isChartsEnabled()) {
                    writeChart(scope, kind, () -> chartGenerationService.generateRollingChart(
                            chartTitle(scope, "Rolling average items/day (" + config.getRollingDays() + "-day)"),
                            averages));
                }
                assetStore.writeArtifact(scope, kind, averages, generatedAt, signal);
            }
            case WORD_FREQUENCIES -> assetStore.writeArtifact(scope, kind,
                    renderer.wordFrequencies(items, config.getExtraStopwords(), config.getMaxWords()),
                    generatedAt, signal);
        }
    }

    private void writeChart(AssetScope scope, AssetKind kind, ChartSupplier supplier) {
        try {
            assetStore.writeChart(scope, kind, supplier.get());
        } catch (IOException e) {
            throw new RenderException("Failed to draw " + kind.getValue() + " chart for " + scope.key(), e);
        }
    }

    private static String chartTitle(AssetScope scope, String subject) {
        return (scope.isGlobal() ? "All sources" : "Source #" + scope.sourceId()) + " : " + subject;
    }

    @FunctionalInterface
    private interface ChartSupplier {
        byte[] get() throws IOException;
    }
}
