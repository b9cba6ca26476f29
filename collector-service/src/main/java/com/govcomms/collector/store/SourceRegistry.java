package com.govcomms.collector.store;

import com.govcomms.collector.entity.Source;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Registered sources. The pipeline only writes fetch timestamps and the item summary.
 */
public interface SourceRegistry {

    List<Source> listEnabledSources();

    Optional<Source> getSource(long sourceId);

    void markChecked(long sourceId, LocalDateTime timestamp);

    void markSuccess(long sourceId, LocalDateTime timestamp);

    /**
     * Recompute first/last item date and item total from the item store.
     */
    void refreshSummary(long sourceId);
}
