package com.flowmable.splitter;

/**
 * Stage 3: decides between skip, cover-trim, split and fallback-center.
 * <p>
 * Rules are tried in order and the first match wins:
 * 1. SKIP (aspect_ratio): width < height * minAspectRatio.
 * 2. SKIP (no_foreground): coverage below minForegroundRatio, or empty mask.
 * 3. COVER_TRIM: content narrower than coverContentRatio and taller than 80% of the page.
 * 4. SPLIT when the locator finds a gutter at or above confidenceThreshold,
 *    otherwise FALLBACK_CENTER at width / 2.
 */
public class ModeClassifier {

    static final double COVER_MIN_HEIGHT_RATIO = 0.8;

    private final SplitConfig config;
    private final SplitLocator locator;

    public ModeClassifier(SplitConfig config) {
        this(config, new SplitLocator(config));
    }

    ModeClassifier(SplitConfig config, SplitLocator locator) {
        this.config = config;
        this.locator = locator;
    }

    /** Rule 1 in isolation; needs no mask. */
    public boolean isSpreadShaped(int width, int height) {
        return width >= height * config.minAspectRatio();
    }

    public ModeDecision classify(ForegroundMask mask) {
        int width = mask.width();
        int height = mask.height();

        if (!isSpreadShaped(width, height)) {
            return ModeDecision.skip(ModeDecision.REASON_ASPECT_RATIO, 0.0);
        }

        double foregroundRatio = mask.foregroundRatio();
        if (foregroundRatio < config.minForegroundRatio() || mask.isEmpty()) {
            return ModeDecision.skip(ModeDecision.REASON_NO_FOREGROUND, foregroundRatio);
        }

        ContentMetrics metrics = ContentMetrics.measure(mask);
        if (metrics.contentWidthRatio() < config.coverContentRatio()
                && metrics.bboxHeightRatio() > COVER_MIN_HEIGHT_RATIO) {
            return ModeDecision.cover(metrics);
        }

        SplitCandidate candidate = locator.locate(mask);
        if (!candidate.found() || candidate.confidence() < config.confidenceThreshold()) {
            return ModeDecision.fallback(metrics, candidate, width / 2, Math.max(candidate.confidence(), 0.0));
        }
        return ModeDecision.split(metrics, candidate, candidate.splitX(), candidate.confidence());
    }
}
