package com.govcomms.collector.repository;

import com.govcomms.collector.entity.IngestionCycle;
import com.govcomms.collector.entity.IngestionCycle.CycleState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
class IngestionCycleRepositoryTest {

    @Autowired
    private IngestionCycleRepository cycleRepository;

    private IngestionCycle cycle(long sourceId, CycleState state, LocalDateTime completedAt) {
        return cycleRepository.save(IngestionCycle.builder()
                .sourceId(sourceId)
                .state(state)
                .startedAt(completedAt != null ? completedAt.minusMinutes(1) : LocalDateTime.now())
                .completedAt(completedAt)
                .build());
    }

    @Test
    @DisplayName("Purge removes completed cycles older than the cutoff and keeps running ones")
    void deleteCompletedBefore() {
        // given
        LocalDateTime cutoff = LocalDateTime.of(2024, 5, 1, 0, 0);
        cycle(1L, CycleState.RENDER_OK, cutoff.minusDays(3));
        IngestionCycle recent = cycle(1L, CycleState.RENDER_SKIPPED, cutoff.plusDays(3));
        IngestionCycle running = cycle(2L, CycleState.FETCHING, null);

        // when
        int deleted = cycleRepository.deleteCompletedBefore(cutoff);

        // then
        assertThat(deleted).isEqualTo(1);
        assertThat(cycleRepository.findAll()).extracting(IngestionCycle::getId)
                .containsExactlyInAnyOrder(recent.getId(), running.getId());
    }
}
