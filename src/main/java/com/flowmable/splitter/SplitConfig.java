package com.flowmable.splitter;

/**
 * Tunable thresholds for the double page splitter.
 * <p>
 * Any modification to the defaults changes split decisions on existing scans;
 * bump {@link #SPLIT_MODEL_VERSION} when doing so.
 *
 * @param minAspectRatio      Minimum width/height ratio for an image to be treated as a spread
 * @param paddingRatio        Safety padding added around crops (fraction of the dimension)
 * @param confidenceThreshold Minimum valley contrast required to accept a located split
 * @param coverContentRatio   Maximum content width ratio still classified as a cover
 * @param edgeExclusionRatio  Fraction of the width ignored at each edge when searching for the gutter
 * @param minForegroundRatio  Images with less foreground than this are skipped
 */
public record SplitConfig(
        double minAspectRatio,
        double paddingRatio,
        double confidenceThreshold,
        double coverContentRatio,
        double edgeExclusionRatio,
        double minForegroundRatio
) {
    public static final String SPLIT_MODEL_VERSION = "1.0";

    public static final SplitConfig DEFAULT = new SplitConfig(
            1.2,   // minAspectRatio
            0.015, // paddingRatio
            0.1,   // confidenceThreshold
            0.45,  // coverContentRatio
            0.12,  // edgeExclusionRatio
            0.01   // minForegroundRatio
    );

    public SplitConfig {
        if (!(minAspectRatio >= 1.0) || Double.isInfinite(minAspectRatio)) {
            throw new IllegalArgumentException("minAspectRatio must be >= 1.0, got: " + minAspectRatio);
        }
        requireRatio("paddingRatio", paddingRatio);
        requireRatio("confidenceThreshold", confidenceThreshold);
        requireRatio("coverContentRatio", coverContentRatio);
        requireRatio("edgeExclusionRatio", edgeExclusionRatio);
        requireRatio("minForegroundRatio", minForegroundRatio);
    }

    /**
     * Returns a copy with every non-null override applied. The aspect ratio gate is not overridable.
     */
    public SplitConfig withOverrides(SplitThresholdOverrides overrides) {
        if (overrides == null) {
            return this;
        }
        return new SplitConfig(
                minAspectRatio,
                orElse(overrides.paddingRatio(), paddingRatio),
                orElse(overrides.confidenceThreshold(), confidenceThreshold),
                orElse(overrides.coverContentRatio(), coverContentRatio),
                orElse(overrides.edgeExclusionRatio(), edgeExclusionRatio),
                orElse(overrides.minForegroundRatio(), minForegroundRatio)
        );
    }

    private static double orElse(Double value, double fallback) {
        return value != null ? value : fallback;
    }

    private static void requireRatio(String name, double value) {
        // NaN fails both comparisons
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be within [0, 1], got: " + value);
        }
    }
}
