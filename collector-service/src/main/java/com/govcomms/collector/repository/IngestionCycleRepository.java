package com.govcomms.collector.repository;

import com.govcomms.collector.entity.IngestionCycle;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;

@Repository
public interface IngestionCycleRepository extends JpaRepository<IngestionCycle, Long> {

    @Modifying
    @Query("DELETE FROM IngestionCycle c WHERE c.completedAt IS NOT NULL AND c.completedAt < :cutoff")
    int deleteCompletedBefore(@Param("cutoff") LocalDateTime cutoff);
}
