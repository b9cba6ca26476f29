package com.govcomms.collector.repository;

import com.govcomms.collector.entity.Source;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface SourceRepository extends JpaRepository<Source, Long> {

    List<Source> findByEnabledTrueOrderByIdAsc();

    @Modifying
    @Query("UPDATE Source s SET s.lastChecked = :timestamp WHERE s.id = :id")
    int updateLastChecked(@Param("id") Long id, @Param("timestamp") LocalDateTime timestamp);

    @Modifying
    @Query("UPDATE Source s SET s.lastSuccess = :timestamp WHERE s.id = :id")
    int updateLastSuccess(@Param("id") Long id, @Param("timestamp") LocalDateTime timestamp);

    @Modifying
    @Query("UPDATE Source s SET s.firstItemDate = :firstDate, s.lastItemDate = :lastDate, " +
           "s.totalItems = :total WHERE s.id = :id")
    int updateSummary(@Param("id") Long id,
                      @Param("firstDate") LocalDate firstDate,
                      @Param("lastDate") LocalDate lastDate,
                      @Param("total") Long total);
}
