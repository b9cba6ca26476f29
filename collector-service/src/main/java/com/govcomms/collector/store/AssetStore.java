package com.govcomms.collector.store;

import com.govcomms.collector.dto.AssetKind;
import com.govcomms.collector.dto.AssetScope;
import com.govcomms.collector.dto.AssetSignal;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Rendered artifacts together with the signal they were generated from.
 */
public interface AssetStore {

    Optional<AssetSignal> getRecordedSignal(AssetScope scope, AssetKind kind);

    /**
     * Replace the artifact data and record the signal it was rendered from.
     */
    void writeArtifact(AssetScope scope, AssetKind kind, Object data, LocalDateTime generatedAt, AssetSignal signal);

    void writeChart(AssetScope scope, AssetKind kind, byte[] png);

    /**
     * True when the artifact file and every file recorded alongside it are present.
     */
    boolean artifactExists(AssetScope scope, AssetKind kind);
}
