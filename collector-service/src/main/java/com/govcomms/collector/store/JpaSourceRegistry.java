package com.govcomms.collector.store;

import com.govcomms.collector.entity.Source;
import com.govcomms.collector.repository.ItemRepository;
import com.govcomms.collector.repository.SourceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class JpaSourceRegistry implements SourceRegistry {

    private final SourceRepository sourceRepository;
    private final ItemRepository itemRepository;

    @Override
    @Transactional(readOnly = true)
    public List<Source> listEnabledSources() {
        return sourceRepository.findByEnabledTrueOrderByIdAsc();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Source> getSource(long sourceId) {
        return sourceRepository.findById(sourceId);
    }

    @Override
    @Transactional
    public void markChecked(long sourceId, LocalDateTime timestamp) {
        sourceRepository.updateLastChecked(sourceId, timestamp);
    }

    @Override
    @Transactional
    public void markSuccess(long sourceId, LocalDateTime timestamp) {
        sourceRepository.updateLastSuccess(sourceId, timestamp);
    }

    @Override
    @Transactional
    public void refreshSummary(long sourceId) {
        LocalDateTime first = itemRepository.findFirstPublishedAt(sourceId);
        LocalDateTime last = itemRepository.findLastPublishedAt(sourceId);
        long total = itemRepository.countBySourceId(sourceId);
        sourceRepository.updateSummary(sourceId, toDate(first), toDate(last), total);
        log.debug("Refreshed summary for source {}: total={}, first={}, last={}", sourceId, total, first, last);
    }

    private static LocalDate toDate(LocalDateTime timestamp) {
        return timestamp != null ? timestamp.toLocalDate() : null;
    }
}
