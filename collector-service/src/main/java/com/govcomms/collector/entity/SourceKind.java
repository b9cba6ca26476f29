package com.govcomms.collector.entity;

/**
 * Kinds of registered sources.
 *
 * - BLOG: HTML blog walked through its "previous post" link chain
 * - VIDEO: video channel listed through the YouTube Data API
 */
public enum SourceKind {
    BLOG("Blog"),
    VIDEO("Video");

    private final String value;

    SourceKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
