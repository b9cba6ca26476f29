package com.govcomms.collector.service;

import com.govcomms.collector.dto.AssetKind;
import com.govcomms.collector.dto.AssetScope;
import com.govcomms.collector.dto.AssetSignal;
import com.govcomms.collector.store.AssetStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class StalenessDetector {

    private final AssetStore assetStore;

    /**
     * An asset is stale when it was never recorded, or when the scope's items gained a newer
     * timestamp or a higher count since it was rendered. A lower count means items left the
     * scope (a disabled source in the global rollup) and is stale too. With
     * {@code catchUpMissing} a missing artifact file is stale as well.
     */
    public boolean isStale(AssetScope scope, AssetKind kind, AssetSignal current, boolean catchUpMissing) {
        Optional<AssetSignal> recorded = assetStore.getRecordedSignal(scope, kind);
        if (recorded.isEmpty()) {
            log.debug("{} {}: no recorded asset", scope, kind.getValue());
            return true;
        }
        if (recorded.get().isOlderThan(current)) {
            log.debug("{} {}: recorded {} older than current {}", scope, kind.getValue(), recorded.get(), current);
            return true;
        }
        if (recorded.get().itemCount() > current.itemCount()) {
            log.debug("{} {}: scope shrank from {} to {} items", scope, kind.getValue(),
                    recorded.get().itemCount(), current.itemCount());
            return true;
        }
        if (catchUpMissing && !assetStore.artifactExists(scope, kind)) {
            log.debug("{} {}: artifact file missing", scope, kind.getValue());
            return true;
        }
        return false;
    }
}
