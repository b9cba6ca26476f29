package com.govcomms.collector.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.net.URI;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Locale;

@Entity
@Table(name = "sources", indexes = {
    @Index(name = "idx_sources_kind", columnList = "kind"),
    @Index(name = "idx_sources_enabled", columnList = "enabled")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Source {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    /**
     * Blog home page or channel URL.
     */
    @Column(name = "url", nullable = false, length = 1024)
    private String url;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 20)
    private SourceKind kind;

    /**
     * Channel id (UC...) for video sources. Resolved from the URL when absent.
     */
    @Column(name = "channel_id", length = 64)
    private String channelId;

    @Column(name = "enabled", nullable = false)
    @Builder.Default
    private Boolean enabled = true;

    @Column(name = "last_checked")
    private LocalDateTime lastChecked;

    @Column(name = "last_success")
    private LocalDateTime lastSuccess;

    @Column(name = "first_item_date")
    private LocalDate firstItemDate;

    @Column(name = "last_item_date")
    private LocalDate lastItemDate;

    @Column(name = "total_items")
    @Builder.Default
    private Long totalItems = 0L;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean isEnabledSource() {
        return Boolean.TRUE.equals(enabled);
    }

    /**
     * Lower-cased host of the source URL, or an empty string when the URL is malformed.
     */
    public String host() {
        if (url == null || url.isBlank()) {
            return "";
        }
        try {
            String host = URI.create(url.trim()).getHost();
            return host != null ? host.toLowerCase(Locale.ROOT) : "";
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    /**
     * Check whether the source was already checked on the given day.
     */
    public boolean wasCheckedOn(LocalDate day) {
        return lastChecked != null && !lastChecked.toLocalDate().isBefore(day);
    }
}
