package com.govcomms.collector.dto;

import java.util.List;

/**
 * Result of rendering one scope.
 *
 * @param rendered kinds regenerated in this pass, empty when every asset was current
 * @param error    failure message, {@code null} on success
 */
public record RenderOutcome(AssetScope scope, List<AssetKind> rendered, String error) {

    public static RenderOutcome skipped(AssetScope scope) {
        return new RenderOutcome(scope, List.of(), null);
    }

    public static RenderOutcome failed(AssetScope scope, String error) {
        return new RenderOutcome(scope, List.of(), error);
    }

    public boolean isSkipped() {
        return error == null && rendered.isEmpty();
    }

    public boolean isFailed() {
        return error != null;
    }
}
