package com.govcomms.collector.dto;

import com.govcomms.collector.entity.SourceKind;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Set;

/**
 * Selection and behaviour options for one pipeline run.
 */
@Value
@Builder(toBuilder = true)
public class RunOptions {

    @Builder.Default
    Set<SourceKind> kinds = Set.of(SourceKind.BLOG, SourceKind.VIDEO);

    Long sourceId;

    /**
     * Restrict to sources whose URL host matches (case-insensitive).
     */
    String host;

    String channelId;

    /**
     * Ignore items published before this day.
     */
    LocalDate since;

    /**
     * Max new items per source, 0 for unlimited.
     */
    @Builder.Default
    int maxItems = 0;

    boolean dryRun;

    /**
     * Process blog sources even when already checked today.
     */
    boolean force;

    @Builder.Default
    boolean renderGlobal = true;

    boolean catchUpMissing;

    /**
     * Override of the blog start page, only meaningful together with a single-source filter.
     */
    String startUrl;

    Boolean uploadsOnly;

    public boolean hasNarrowingFilter() {
        return sourceId != null || (host != null && !host.isBlank())
                || (channelId != null && !channelId.isBlank());
    }
}
