package com.govcomms.collector.dto;

import java.time.LocalDateTime;

/**
 * Change signal of a scope's item set: newest item timestamp and item count.
 *
 * @param maxTimestamp newest published timestamp, {@code null} when no item carries one
 * @param itemCount    number of items in the scope
 */
public record AssetSignal(LocalDateTime maxTimestamp, long itemCount) {

    public static final AssetSignal EMPTY = new AssetSignal(null, 0L);

    /**
     * True when {@code current} carries a newer timestamp or a higher count than this recorded signal.
     */
    public boolean isOlderThan(AssetSignal current) {
        if (current == null) {
            return false;
        }
        if (itemCount < current.itemCount()) {
            return true;
        }
        if (current.maxTimestamp() == null) {
            return false;
        }
        return maxTimestamp == null || maxTimestamp.isBefore(current.maxTimestamp());
    }
}
