package com.govcomms.collector.service.render;

import com.govcomms.collector.dto.AssetScope;
import com.govcomms.collector.dto.RenderOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Global rollup over the union of all enabled sources' items.
 *
 * Always recomputed from raw items, never by summing per-source assets. Must run after the
 * per-source cycles of a run have completed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GlobalAssetAggregator {

    private final AssetRenderService assetRenderService;

    public RenderOutcome aggregate(boolean catchUpMissing) {
        log.info("Running global aggregation");
        return assetRenderService.renderScope(AssetScope.global(), catchUpMissing);
    }
}
