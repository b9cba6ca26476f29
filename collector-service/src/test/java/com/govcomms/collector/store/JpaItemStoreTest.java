package com.govcomms.collector.store;

import com.govcomms.collector.dto.AssetScope;
import com.govcomms.collector.dto.AssetSignal;
import com.govcomms.collector.entity.Item;
import com.govcomms.collector.entity.Source;
import com.govcomms.collector.entity.SourceKind;
import com.govcomms.collector.repository.SourceRepository;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@Import({JpaItemStore.class, JpaSourceRegistry.class})
class JpaItemStoreTest {

    @Autowired
    private JpaItemStore itemStore;

    @Autowired
    private JpaSourceRegistry sourceRegistry;

    @Autowired
    private SourceRepository sourceRepository;

    @Autowired
    private EntityManager entityManager;

    private Source blog;
    private Source channel;

    @BeforeEach
    void setUp() {
        blog = sourceRepository.save(Source.builder()
                .name("Design blog")
                .url("https://design.example.gov.uk")
                .kind(SourceKind.BLOG)
                .build());
        channel = sourceRepository.save(Source.builder()
                .name("Video channel")
                .url("https://www.youtube.com/@example")
                .kind(SourceKind.VIDEO)
                .build());
    }

    private Item item(Source source, String externalId, String title, LocalDateTime publishedAt) {
        return Item.builder()
                .sourceId(source.getId())
                .externalId(externalId)
                .title(title)
                .publishedAt(publishedAt)
                .fetchedAt(LocalDateTime.of(2024, 6, 1, 10, 0))
                .build();
    }

    @Test
    @DisplayName("Second insert of the same key is reported as a duplicate")
    void duplicateInsert() {
        // given
        assertThat(itemStore.insert(item(blog, "post-1", "First", LocalDateTime.of(2024, 5, 1, 9, 0)))).isTrue();

        // when
        boolean second = itemStore.insert(item(blog, "post-1", "First, edited", LocalDateTime.of(2024, 5, 2, 9, 0)));

        // then
        assertThat(second).isFalse();
        assertThat(itemStore.exists(blog.getId(), "post-1")).isTrue();
        assertThat(itemStore.itemsFor(AssetScope.source(blog.getId())))
                .singleElement()
                .extracting(Item::getTitle)
                .isEqualTo("First");
    }

    @Test
    @DisplayName("Same external id under another source is a different item")
    void keyIncludesSource() {
        itemStore.insert(item(blog, "shared", "Blog", LocalDateTime.of(2024, 5, 1, 9, 0)));

        assertThat(itemStore.insert(item(channel, "shared", "Video", LocalDateTime.of(2024, 5, 1, 9, 0)))).isTrue();
    }

    @Test
    @DisplayName("Global signal and items cover enabled sources only")
    void globalScope() {
        // given
        itemStore.insert(item(blog, "b1", "Blog", LocalDateTime.of(2024, 5, 1, 9, 0)));
        itemStore.insert(item(channel, "v1", "Video", LocalDateTime.of(2024, 5, 9, 9, 0)));
        itemStore.insert(item(channel, "v2", "Undated video", null));

        // when
        AssetSignal before = itemStore.maxSignal(AssetScope.global());
        channel.setEnabled(false);
        sourceRepository.saveAndFlush(channel);
        AssetSignal after = itemStore.maxSignal(AssetScope.global());

        // then
        assertThat(before).isEqualTo(new AssetSignal(LocalDateTime.of(2024, 5, 9, 9, 0), 3));
        assertThat(after).isEqualTo(new AssetSignal(LocalDateTime.of(2024, 5, 1, 9, 0), 1));
        assertThat(itemStore.itemsFor(AssetScope.global())).extracting(Item::getExternalId).containsExactly("b1");
    }

    @Test
    @DisplayName("Empty scope has an empty signal")
    void emptySignal() {
        assertThat(itemStore.maxSignal(AssetScope.source(blog.getId()))).isEqualTo(AssetSignal.EMPTY);
    }

    @Test
    @DisplayName("Summary and latest items feed the health report")
    void summaryAndLatest() {
        itemStore.insert(item(blog, "p1", "One", LocalDateTime.of(2024, 1, 3, 9, 0)));
        itemStore.insert(item(blog, "p2", "  ", LocalDateTime.of(2024, 2, 3, 9, 0)));
        itemStore.insert(item(blog, "p3", "Three", LocalDateTime.of(2024, 3, 3, 9, 0)));
        itemStore.insert(item(blog, "p4", "Undated", null));

        ItemSummary summary = itemStore.summary(blog.getId());
        List<Item> latest = itemStore.latest(blog.getId(), 2);

        assertThat(summary).isEqualTo(new ItemSummary(4, 3, 1,
                LocalDateTime.of(2024, 1, 3, 9, 0), LocalDateTime.of(2024, 3, 3, 9, 0)));
        assertThat(latest).extracting(Item::getExternalId).containsExactly("p3", "p2");
    }

    @Test
    @DisplayName("Registry updates check times and the stored summary")
    void registryUpdates() {
        // given
        itemStore.insert(item(blog, "p1", "One", LocalDateTime.of(2024, 1, 3, 9, 0)));
        itemStore.insert(item(blog, "p2", "Two", LocalDateTime.of(2024, 4, 3, 9, 0)));

        // when
        sourceRegistry.markChecked(blog.getId(), LocalDateTime.of(2024, 6, 1, 10, 0));
        sourceRegistry.markSuccess(blog.getId(), LocalDateTime.of(2024, 6, 1, 10, 5));
        sourceRegistry.refreshSummary(blog.getId());
        entityManager.clear();

        // then
        Source reloaded = sourceRegistry.getSource(blog.getId()).orElseThrow();
        assertThat(reloaded.getLastChecked()).isEqualTo(LocalDateTime.of(2024, 6, 1, 10, 0));
        assertThat(reloaded.getLastSuccess()).isEqualTo(LocalDateTime.of(2024, 6, 1, 10, 5));
        assertThat(reloaded.getTotalItems()).isEqualTo(2);
        assertThat(reloaded.getFirstItemDate()).isEqualTo(LocalDate.of(2024, 1, 3));
        assertThat(reloaded.getLastItemDate()).isEqualTo(LocalDate.of(2024, 4, 3));
        assertThat(sourceRegistry.listEnabledSources()).extracting(Source::getId)
                .containsExactly(blog.getId(), channel.getId());
    }
}
