package com.flowmable.splitter;

/**
 * Optional per-run threshold overrides. A {@code null} component keeps the base value.
 */
public record SplitThresholdOverrides(
        Double paddingRatio,
        Double coverContentRatio,
        Double confidenceThreshold,
        Double edgeExclusionRatio,
        Double minForegroundRatio
) {
    public static final SplitThresholdOverrides NONE = new SplitThresholdOverrides(null, null, null, null, null);
}
