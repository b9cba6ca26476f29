package com.govcomms.collector.service;

import com.govcomms.collector.dto.CandidateItem;
import com.govcomms.collector.dto.IngestionSummary;
import com.govcomms.collector.dto.IngestionSummary.Outcome;
import com.govcomms.collector.entity.Item;
import com.govcomms.collector.entity.Source;
import com.govcomms.collector.exception.SourceCycleFailedException;
import com.govcomms.collector.store.ItemStore;
import com.govcomms.collector.support.InMemoryItemStore;
import com.govcomms.collector.support.TestSources;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private ItemStore mockStore;

    private InMemoryItemStore itemStore;
    private IngestionService ingestionService;
    private Source source;

    @BeforeEach
    void setUp() {
        itemStore = new InMemoryItemStore();
        ingestionService = new IngestionService(itemStore, CLOCK);
        source = TestSources.blog(1L, "https://blog.example.gov.uk");
    }

    private static List<CandidateItem> candidates(int count) {
        return IntStream.rangeClosed(1, count)
                .mapToObj(i -> CandidateItem.builder()
                        .externalId("https://blog.example.gov.uk/post-" + i)
                        .title("Post " + i)
                        .publishedAt(LocalDateTime.of(2024, 1, i, 9, 0))
                        .build())
                .toList();
    }

    @Test
    @DisplayName("Two ingestions of identical upstream data insert N then 0")
    void idempotent() {
        // given
        List<CandidateItem> upstream = candidates(4);

        // when
        IngestionSummary first = ingestionService.ingest(source, upstream.stream(), false);
        IngestionSummary second = ingestionService.ingest(source, upstream.stream(), false);

        // then
        assertThat(first.newCount()).isEqualTo(4);
        assertThat(first.skippedCount()).isZero();
        assertThat(second.newCount()).isZero();
        assertThat(second.skippedCount()).isEqualTo(4);
        assertThat(itemStore.count(1L)).isEqualTo(4);
    }

    @Test
    @DisplayName("Duplicates within one stream are stored once")
    void uniqueness() {
        CandidateItem item = candidates(1).get(0);

        IngestionSummary summary = ingestionService.ingest(source, Stream.of(item, item, item), false);

        assertThat(summary.newCount()).isEqualTo(1);
        assertThat(summary.skippedCount()).isEqualTo(2);
        assertThat(itemStore.all()).hasSize(1);
    }

    @Test
    @DisplayName("Stored item is never refreshed by a later ingestion")
    void immutableOnceStored() {
        // given
        itemStore.add(1L, "https://blog.example.gov.uk/post-1", "Original title", LocalDateTime.of(2024, 1, 1, 9, 0));
        CandidateItem changed = candidates(1).get(0).toBuilder().title("Edited title").build();

        // when
        ingestionService.ingest(source, Stream.of(changed), false);

        // then
        assertThat(itemStore.all()).extracting(Item::getTitle).containsExactly("Original title");
    }

    @Test
    @DisplayName("Malformed candidates are skipped with a warning")
    void malformed() {
        Stream<CandidateItem> stream = Stream.of(
                CandidateItem.malformed("https://blog.example.gov.uk/broken", "no title"),
                candidates(1).get(0));

        IngestionSummary summary = ingestionService.ingest(source, stream, false);

        assertThat(summary.newCount()).isEqualTo(1);
        assertThat(summary.skippedCount()).isEqualTo(1);
        assertThat(summary.warningCount()).isEqualTo(1);
        assertThat(itemStore.exists(1L, "https://blog.example.gov.uk/broken")).isFalse();
    }

    @Test
    @DisplayName("Dry run counts new items without writing")
    void dryRun() {
        List<CandidateItem> upstream = candidates(3);

        IngestionSummary summary = ingestionService.ingest(source,
                Stream.concat(upstream.stream(), Stream.of(upstream.get(0))), true);

        assertThat(summary.newCount()).isEqualTo(3);
        assertThat(summary.skippedCount()).isEqualTo(1);
        assertThat(itemStore.all()).isEmpty();
    }

    @Test
    @DisplayName("Fetch failure mid-stream keeps the items already inserted")
    void fetchFailureKeepsInserted() {
        // given
        Stream<CandidateItem> failing = Stream.concat(candidates(2).stream(),
                Stream.<CandidateItem>generate(() -> {
                    throw new SourceCycleFailedException("retries exhausted");
                }).limit(1));

        // when
        IngestionSummary summary = ingestionService.ingest(source, failing, false);

        // then
        assertThat(summary.outcome()).isEqualTo(Outcome.FETCH_FAILED);
        assertThat(summary.newCount()).isEqualTo(2);
        assertThat(summary.lastError()).contains("retries exhausted");
        assertThat(itemStore.count(1L)).isEqualTo(2);
    }

    @Test
    @DisplayName("Unexpected error mid-stream is a fetch failure that keeps the counts so far")
    void unexpectedStreamError() {
        // given
        Stream<CandidateItem> failing = Stream.concat(candidates(2).stream(),
                Stream.<CandidateItem>generate(() -> {
                    throw new IllegalStateException("unexpected markup");
                }).limit(1));

        // when
        IngestionSummary summary = ingestionService.ingest(source, failing, false);

        // then
        assertThat(summary.outcome()).isEqualTo(Outcome.FETCH_FAILED);
        assertThat(summary.newCount()).isEqualTo(2);
        assertThat(summary.lastError()).isEqualTo("unexpected markup");
        assertThat(itemStore.count(1L)).isEqualTo(2);
    }

    @Test
    @DisplayName("Failing existence lookup is a store failure")
    void lookupFailure() {
        IngestionService withMock = new IngestionService(mockStore, CLOCK);
        when(mockStore.exists(anyLong(), anyString()))
                .thenThrow(new DataAccessResourceFailureException("connection reset"));

        IngestionSummary summary = withMock.ingest(source, candidates(2).stream(), false);

        assertThat(summary.outcome()).isEqualTo(Outcome.STORE_FAILED);
        assertThat(summary.newCount()).isZero();
        verify(mockStore, never()).insert(any(Item.class));
    }

    @Test
    @DisplayName("Store write failure aborts the ingestion")
    void storeFailure() {
        itemStore.failInsertsAfter(1);

        IngestionSummary summary = ingestionService.ingest(source, candidates(3).stream(), false);

        assertThat(summary.outcome()).isEqualTo(Outcome.STORE_FAILED);
        assertThat(summary.newCount()).isEqualTo(1);
        assertThat(itemStore.count(1L)).isEqualTo(1);
    }

    @Test
    @DisplayName("Insert losing a race to a concurrent writer counts as skipped")
    void racingInsert() {
        // given
        IngestionService withMock = new IngestionService(mockStore, CLOCK);
        when(mockStore.exists(anyLong(), anyString())).thenReturn(false);
        when(mockStore.insert(any(Item.class))).thenReturn(false);

        // when
        IngestionSummary summary = withMock.ingest(source, candidates(1).stream(), false);

        // then
        assertThat(summary.newCount()).isZero();
        assertThat(summary.skippedCount()).isEqualTo(1);
        assertThat(summary.isCompleted()).isTrue();
    }

    @Test
    @DisplayName("Dry run never touches the store's write path")
    void dryRunNoInsert() {
        IngestionService withMock = new IngestionService(mockStore, CLOCK);
        when(mockStore.exists(anyLong(), anyString())).thenReturn(false);

        withMock.ingest(source, candidates(2).stream(), true);

        verify(mockStore, never()).insert(any(Item.class));
    }
}
