package com.govcomms.collector.store;

import com.govcomms.collector.dto.AssetScope;
import com.govcomms.collector.dto.AssetSignal;
import com.govcomms.collector.entity.Item;
import com.govcomms.collector.exception.StoreWriteException;
import com.govcomms.collector.repository.ItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class JpaItemStore implements ItemStore {

    private final ItemRepository itemRepository;

    @Override
    @Transactional(readOnly = true)
    public boolean exists(long sourceId, String externalId) {
        return itemRepository.existsBySourceIdAndExternalId(sourceId, externalId);
    }

    /**
     * Runs in its own short transaction per item, so a crash mid-cycle keeps every committed insert
     * and the unique constraint settles racing inserts of the same key.
     */
    @Override
    public boolean insert(Item item) {
        try {
            if (itemRepository.existsBySourceIdAndExternalId(item.getSourceId(), item.getExternalId())) {
                return false;
            }
            itemRepository.saveAndFlush(item);
            return true;
        } catch (DataIntegrityViolationException e) {
            if (!storedByAnotherWriter(item)) {
                throw insertFailed(item, e);
            }
            log.debug("Concurrent insert of source={}, externalId={} resolved as duplicate",
                    item.getSourceId(), item.getExternalId());
            return false;
        } catch (DataAccessException e) {
            throw insertFailed(item, e);
        }
    }

    // any other constraint violation (null or oversized column) leaves the key absent
    private boolean storedByAnotherWriter(Item item) {
        try {
            return itemRepository.existsBySourceIdAndExternalId(item.getSourceId(), item.getExternalId());
        } catch (DataAccessException e) {
            log.warn("Could not re-check item {} of source {}: {}",
                    item.getExternalId(), item.getSourceId(), e.getMessage());
            return false;
        }
    }

    private static StoreWriteException insertFailed(Item item, DataAccessException cause) {
        return new StoreWriteException(
                "Failed to insert item " + item.getExternalId() + " of source " + item.getSourceId(), cause);
    }

    @Override
    @Transactional(readOnly = true)
    public AssetSignal maxSignal(AssetScope scope) {
        if (scope.isGlobal()) {
            return new AssetSignal(itemRepository.findLastPublishedAtOfEnabledSources(),
                    itemRepository.countAllOfEnabledSources());
        }
        return new AssetSignal(itemRepository.findLastPublishedAt(scope.sourceId()),
                itemRepository.countBySourceId(scope.sourceId()));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Item> itemsFor(AssetScope scope) {
        if (scope.isGlobal()) {
            return itemRepository.findAllOfEnabledSources();
        }
        return itemRepository.findBySourceIdOrderByPublishedAtAsc(scope.sourceId());
    }

    @Override
    @Transactional(readOnly = true)
    public ItemSummary summary(long sourceId) {
        return new ItemSummary(
                itemRepository.countBySourceId(sourceId),
                itemRepository.countTitledBySourceId(sourceId),
                itemRepository.countBySourceIdAndPublishedAtIsNull(sourceId),
                itemRepository.findFirstPublishedAt(sourceId),
                itemRepository.findLastPublishedAt(sourceId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Item> latest(long sourceId, int limit) {
        return itemRepository.findBySourceIdAndPublishedAtIsNotNullOrderByPublishedAtDesc(
                sourceId, PageRequest.of(0, Math.max(1, limit)));
    }
}
