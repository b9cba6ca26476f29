package com.govcomms.collector.store;

import com.govcomms.collector.dto.AssetScope;
import com.govcomms.collector.dto.AssetSignal;
import com.govcomms.collector.entity.Item;

import java.util.List;

/**
 * Persistent items keyed by {@code (sourceId, externalId)}.
 */
public interface ItemStore {

    boolean exists(long sourceId, String externalId);

    /**
     * Insert a new item.
     *
     * @return {@code false} when an item with the same key already exists; the stored item is left untouched
     * @throws com.govcomms.collector.exception.StoreWriteException on any other write failure
     */
    boolean insert(Item item);

    AssetSignal maxSignal(AssetScope scope);

    /**
     * Items of the scope ordered by published timestamp, oldest first.
     * The global scope covers enabled sources only.
     */
    List<Item> itemsFor(AssetScope scope);

    ItemSummary summary(long sourceId);

    /**
     * Newest dated items of a source, newest first.
     */
    List<Item> latest(long sourceId, int limit);
}
