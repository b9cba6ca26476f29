package com.govcomms.collector.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One ingested post or video. Immutable once stored.
 */
@Entity
@Table(name = "items",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_items_source_external", columnNames = {"source_id", "external_id"})
    },
    indexes = {
        @Index(name = "idx_items_source_id", columnList = "source_id"),
        @Index(name = "idx_items_published_at", columnList = "published_at")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Item {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "source_id", nullable = false)
    private Long sourceId;

    /**
     * Post URL for blogs, video id for channels.
     */
    @Column(name = "external_id", nullable = false, length = 1024)
    private String externalId;

    @Column(name = "title", columnDefinition = "TEXT")
    private String title;

    @Column(name = "published_at")
    private LocalDateTime publishedAt;

    @Column(name = "fetched_at", nullable = false)
    private LocalDateTime fetchedAt;

    // blog link chain
    @Column(name = "previous_url", length = 1024)
    private String previousUrl;

    @Column(name = "next_url", length = 1024)
    private String nextUrl;

    // video metadata
    @Column(name = "discovered_via", length = 128)
    private String discoveredVia;

    @Column(name = "duration_seconds")
    private Long durationSeconds;
}
