package com.govcomms.collector.dto;

import lombok.Builder;

import java.time.LocalDateTime;

/**
 * Item as produced by a fetcher, before ingestion.
 *
 * @param parseError reason the upstream record could not be parsed; such candidates are never stored
 */
@Builder(toBuilder = true)
public record CandidateItem(
        String externalId,
        String title,
        LocalDateTime publishedAt,
        String previousUrl,
        String nextUrl,
        String discoveredVia,
        Long durationSeconds,
        String parseError
) {
    public static CandidateItem malformed(String externalId, String reason) {
        return CandidateItem.builder()
                .externalId(externalId)
                .parseError(reason)
                .build();
    }

    public boolean isMalformed() {
        return parseError != null || externalId == null || externalId.isBlank();
    }
}
