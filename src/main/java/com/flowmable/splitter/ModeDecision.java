package com.flowmable.splitter;

/**
 * Outcome of {@link ModeClassifier}: which mode applies and the evidence behind it.
 *
 * @param mode            Selected mode
 * @param reason          Skip reason ({@code aspect_ratio}, {@code no_foreground}); null otherwise
 * @param foregroundRatio Mask coverage; 0 when the mask was never consulted
 * @param metrics         Content geometry; null for skips
 * @param candidate       Locator output; null unless the split search ran
 * @param splitX          Column to split at; null unless two pages are produced
 * @param confidence      Trust in the decision [0, 1]
 */
public record ModeDecision(
        SplitMode mode,
        String reason,
        double foregroundRatio,
        ContentMetrics metrics,
        SplitCandidate candidate,
        Integer splitX,
        double confidence
) {
    public static final String REASON_ASPECT_RATIO = "aspect_ratio";
    public static final String REASON_NO_FOREGROUND = "no_foreground";

    static ModeDecision skip(String reason, double foregroundRatio) {
        return new ModeDecision(SplitMode.SKIP, reason, foregroundRatio, null, null, null, 0.0);
    }

    static ModeDecision cover(ContentMetrics metrics) {
        return new ModeDecision(SplitMode.COVER_TRIM, null, metrics.foregroundRatio(), metrics, null, null, 1.0);
    }

    static ModeDecision split(ContentMetrics metrics, SplitCandidate candidate, int splitX, double confidence) {
        return new ModeDecision(SplitMode.SPLIT, null, metrics.foregroundRatio(), metrics, candidate, splitX, confidence);
    }

    static ModeDecision fallback(ContentMetrics metrics, SplitCandidate candidate, int splitX, double confidence) {
        return new ModeDecision(SplitMode.FALLBACK_CENTER, null, metrics.foregroundRatio(), metrics, candidate,
                splitX, confidence);
    }
}
