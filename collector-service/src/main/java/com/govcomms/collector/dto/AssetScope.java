package com.govcomms.collector.dto;

/**
 * Rendering scope: one source, or the union of all enabled sources.
 *
 * @param sourceId owning source id, {@code null} for the global scope
 */
public record AssetScope(Long sourceId) {

    private static final AssetScope GLOBAL = new AssetScope(null);

    public static AssetScope source(long sourceId) {
        return new AssetScope(sourceId);
    }

    public static AssetScope global() {
        return GLOBAL;
    }

    public boolean isGlobal() {
        return sourceId == null;
    }

    /**
     * Stable key, {@code source:<id>} or {@code global}.
     */
    public String key() {
        return isGlobal() ? "global" : "source:" + sourceId;
    }

    @Override
    public String toString() {
        return key();
    }
}
