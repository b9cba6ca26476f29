package com.govcomms.collector.repository;

import com.govcomms.collector.entity.Item;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface ItemRepository extends JpaRepository<Item, Long> {

    boolean existsBySourceIdAndExternalId(Long sourceId, String externalId);

    List<Item> findBySourceIdOrderByPublishedAtAsc(Long sourceId);

    List<Item> findBySourceIdAndPublishedAtIsNotNullOrderByPublishedAtDesc(Long sourceId, Pageable pageable);

    long countBySourceId(Long sourceId);

    long countBySourceIdAndPublishedAtIsNull(Long sourceId);

    @Query("SELECT COUNT(i) FROM Item i WHERE i.sourceId = :sourceId " +
           "AND i.title IS NOT NULL AND TRIM(i.title) <> ''")
    long countTitledBySourceId(@Param("sourceId") Long sourceId);

    @Query("SELECT MIN(i.publishedAt) FROM Item i WHERE i.sourceId = :sourceId")
    LocalDateTime findFirstPublishedAt(@Param("sourceId") Long sourceId);

    @Query("SELECT MAX(i.publishedAt) FROM Item i WHERE i.sourceId = :sourceId")
    LocalDateTime findLastPublishedAt(@Param("sourceId") Long sourceId);

    /**
     * Items of every enabled source. Items of disabled sources never reach global assets.
     */
    @Query("SELECT i FROM Item i WHERE i.sourceId IN " +
           "(SELECT s.id FROM Source s WHERE s.enabled = true) ORDER BY i.publishedAt ASC")
    List<Item> findAllOfEnabledSources();

    @Query("SELECT COUNT(i) FROM Item i WHERE i.sourceId IN " +
           "(SELECT s.id FROM Source s WHERE s.enabled = true)")
    long countAllOfEnabledSources();

    @Query("SELECT MAX(i.publishedAt) FROM Item i WHERE i.sourceId IN " +
           "(SELECT s.id FROM Source s WHERE s.enabled = true)")
    LocalDateTime findLastPublishedAtOfEnabledSources();
}
