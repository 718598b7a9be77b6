package com.flowmable.splitter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModeClassifierTest {

    /** Locator that always proposes the same candidate. */
    private static SplitLocator fixed(SplitCandidate candidate) {
        return new SplitLocator(SplitConfig.DEFAULT) {
            @Override
            public SplitCandidate locate(ForegroundMask mask) {
                return candidate;
            }
        };
    }

    private static ModeClassifier classifier(SplitCandidate candidate) {
        return new ModeClassifier(SplitConfig.DEFAULT, fixed(candidate));
    }

    private static final ForegroundMask WIDE_CONTENT = ContentMetricsTest.maskWithRect(40, 20, 2, 2, 38, 18);

    @Test
    void squareMask_skippedOnAspectRatio() {
        ForegroundMask mask = ContentMetricsTest.maskWithRect(30, 30, 2, 2, 28, 28);
        ModeDecision decision = classifier(SplitCandidate.none()).classify(mask);

        assertEquals(SplitMode.SKIP, decision.mode());
        assertEquals(ModeDecision.REASON_ASPECT_RATIO, decision.reason());
    }

    @Test
    void emptyMask_skippedForNoForeground() {
        ForegroundMask mask = ForegroundMask.of(40, 20, new boolean[800]);
        ModeDecision decision = classifier(SplitCandidate.none()).classify(mask);

        assertEquals(SplitMode.SKIP, decision.mode());
        assertEquals(ModeDecision.REASON_NO_FOREGROUND, decision.reason());
        assertEquals(0.0, decision.foregroundRatio());
    }

    @Test
    void sparseInk_belowMinimumIsSkipped() {
        ForegroundMask mask = ContentMetricsTest.maskWith(100, 50, new int[][]{{10, 10}});
        ModeDecision decision = classifier(SplitCandidate.none()).classify(mask);

        assertEquals(SplitMode.SKIP, decision.mode());
        assertEquals(ModeDecision.REASON_NO_FOREGROUND, decision.reason());
        assertEquals(1.0 / 5000, decision.foregroundRatio(), 1e-12);
    }

    @Test
    void narrowTallContent_isCover() {
        ForegroundMask mask = ContentMetricsTest.maskWithRect(100, 50, 40, 2, 60, 48);
        ModeDecision decision = classifier(new SplitCandidate(50, 0.9, 0.0, 12, 1.0)).classify(mask);

        assertEquals(SplitMode.COVER_TRIM, decision.mode());
        assertEquals(1.0, decision.confidence());
        assertNull(decision.splitX());
        assertNull(decision.candidate());
    }

    @Test
    void narrowShortContent_isNotCover() {
        ForegroundMask mask = ContentMetricsTest.maskWithRect(100, 50, 40, 10, 60, 40);
        ModeDecision decision = classifier(new SplitCandidate(50, 0.9, 0.0, 12, 1.0)).classify(mask);

        assertEquals(SplitMode.SPLIT, decision.mode());
    }

    @Test
    void confidentCandidate_splitsAtCandidate() {
        SplitCandidate candidate = new SplitCandidate(17, 0.5, 0.02, 5, 500.0);
        ModeDecision decision = classifier(candidate).classify(WIDE_CONTENT);

        assertEquals(SplitMode.SPLIT, decision.mode());
        assertEquals(17, decision.splitX());
        assertEquals(0.5, decision.confidence());
        assertSame(candidate, decision.candidate());
    }

    @Test
    void weakCandidate_fallsBackToCenterKeepingConfidence() {
        ModeDecision decision = classifier(new SplitCandidate(17, 0.05, 0.02, 5, 500.0)).classify(WIDE_CONTENT);

        assertEquals(SplitMode.FALLBACK_CENTER, decision.mode());
        assertEquals(20, decision.splitX());
        assertEquals(0.05, decision.confidence());
    }

    @Test
    void missingCandidate_fallsBackWithZeroConfidence() {
        ModeDecision decision = classifier(SplitCandidate.none()).classify(WIDE_CONTENT);

        assertEquals(SplitMode.FALLBACK_CENTER, decision.mode());
        assertEquals(20, decision.splitX());
        assertEquals(0.0, decision.confidence());
    }

    @Test
    void thresholdIsInclusive() {
        ModeDecision decision = classifier(new SplitCandidate(17, 0.1, 0.0, 5, 1.0)).classify(WIDE_CONTENT);
        assertEquals(SplitMode.SPLIT, decision.mode());
    }

    @Test
    void spreadShape_usesMinAspectRatio() {
        ModeClassifier classifier = new ModeClassifier(SplitConfig.DEFAULT);
        assertTrue(classifier.isSpreadShaped(130, 100));
        assertFalse(classifier.isSpreadShaped(119, 100));
    }
}
