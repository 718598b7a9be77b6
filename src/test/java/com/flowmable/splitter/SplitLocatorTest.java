package com.flowmable.splitter;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SplitLocatorTest {

    private final SplitLocator locator = new SplitLocator(SplitConfig.DEFAULT);

    /** Flat projection of height 100 with a triangular valley of the given depth at the center. */
    static double[] valleyProjection(int length, int halfWidth, double depth) {
        double[] p = new double[length];
        int center = length / 2;
        for (int i = 0; i < length; i++) {
            int d = Math.abs(i - center);
            p[i] = d < halfWidth ? 100.0 - depth * (1.0 - (double) d / halfWidth) : 100.0;
        }
        return p;
    }

    @Test
    void collectValleys_identifiesLocalMinima() {
        double[] data = {3.0, 2.0, 3.0, 1.0, 4.0};
        assertEquals(List.of(1, 3), SplitLocator.collectValleys(data, 0, data.length));
    }

    @Test
    void collectValleys_plateauContributesEverySample() {
        double[] data = {5.0, 5.0, 5.0, 5.0};
        assertEquals(List.of(1, 2), SplitLocator.collectValleys(data, 0, data.length));
    }

    @Test
    void smooth_preservesLengthAndConstants() {
        double[] bumpy = {0.0, 1.0, 0.0, 1.0, 0.0};
        assertEquals(bumpy.length, SplitLocator.smooth(bumpy, 1.0).length);

        double[] flat = new double[50];
        Arrays.fill(flat, 7.0);
        double[] out = SplitLocator.smooth(flat, 2.5);
        for (double v : out) {
            assertEquals(7.0, v, 1e-9);
        }
    }

    @Test
    void emptyProjection_hasNoCandidate() {
        SplitCandidate candidate = locator.locate(new double[300]);

        assertFalse(candidate.found());
        assertTrue(candidate.toMetadata().isEmpty());
    }

    @Test
    void narrowProjection_windowCollapses() {
        double[] p = new double[10];
        Arrays.fill(p, 3.0);
        SplitCandidate candidate = locator.locate(p);

        assertFalse(candidate.found());
        assertEquals(5, candidate.edgeMargin());
        assertEquals(5, candidate.toMetadata().get("projection_edge_margin"));
        assertFalse(candidate.toMetadata().containsKey("projection_imbalance"));
    }

    @Test
    void twoBlocks_gutterFoundBetweenThem() {
        double[] p = new double[800];
        for (int x = 40; x <= 360; x++) p[x] = 321;
        for (int x = 440; x <= 760; x++) p[x] = 321;

        SplitCandidate candidate = locator.locate(p);

        assertTrue(candidate.found());
        // Every column of the zero gutter scores the same; the first one wins
        assertEquals(377, (int) candidate.splitX());
        assertEquals(1.0, candidate.confidence(), 1e-6);
        assertEquals(96, candidate.edgeMargin());
        assertTrue(candidate.imbalance() < 0.01);
    }

    @Test
    void flatWindow_zeroConfidence() {
        double[] p = new double[820];
        for (int x = 40; x <= 780; x++) p[x] = 321;

        SplitCandidate candidate = locator.locate(p);

        assertTrue(candidate.found());
        assertEquals(0.0, candidate.confidence());
        assertTrue(Math.abs(candidate.splitX() - 410) <= 1, "splitX " + candidate.splitX());
    }

    @Test
    void deeperValley_neverLowersConfidence() {
        double previous = -1.0;
        for (double depth : new double[]{5, 10, 30, 50, 70, 90, 100}) {
            SplitCandidate candidate = locator.locate(valleyProjection(400, 40, depth));
            assertTrue(candidate.found());
            assertEquals(200, (int) candidate.splitX());
            assertTrue(candidate.confidence() >= previous,
                    "depth " + depth + " gave " + candidate.confidence() + " after " + previous);
            previous = candidate.confidence();
        }
        assertTrue(previous > 0.9);
    }

    @Test
    void candidateMetadata_keys() {
        SplitCandidate candidate = locator.locate(valleyProjection(400, 40, 60));
        assertEquals(List.of("projection_imbalance", "projection_edge_margin", "projection_total_mass"),
                List.copyOf(candidate.toMetadata().keySet()));
    }
}
