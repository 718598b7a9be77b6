package com.flowmable.splitter;

import java.util.ArrayList;
import java.util.List;

/**
 * Stage 4: finds the most plausible vertical gutter via column-projection analysis.
 * <p>
 * 1. Project ink mass per column.
 * 2. Smooth with a 1-D Gaussian (sigma = max(width / 200, 1), replicated borders)
 *    so single-column noise fades while the broad valley of a gutter survives.
 * 3. Ignore an edge margin on both sides; outer bindings and scan borders create
 *    spurious minima there.
 * 4. Collect local minima inside the window (or the window's global minimum).
 * 5. Score: |left mass fraction - 0.5| + 0.1 * (valley / window max). Lowest wins,
 *    first index on ties.
 * 6. Confidence is the chosen valley's relative depth below the window max.
 * <p>
 * The scoring weights are tuned constants; keep them bit-for-bit.
 */
public class SplitLocator {

    private static final double EPS = 1e-6;
    private static final double DEPTH_WEIGHT = 0.1;
    private static final double TARGET_BALANCE = 0.5;
    private static final int MIN_EDGE_MARGIN = 5;
    private static final double SIGMA_DIVISOR = 200.0;

    private final double edgeExclusionRatio;

    public SplitLocator(SplitConfig config) {
        this.edgeExclusionRatio = config.edgeExclusionRatio();
    }

    public SplitCandidate locate(ForegroundMask mask) {
        return locate(mask.columnProjection());
    }

    /**
     * Run the search on a raw (unsmoothed) column projection.
     */
    public SplitCandidate locate(double[] projection) {
        int width = projection.length;
        if (width == 0 || max(projection, 0, width) <= 0) {
            return SplitCandidate.none();
        }

        double sigma = Math.max(width / SIGMA_DIVISOR, 1.0);
        double[] smoothed = smooth(projection, sigma);

        int edgeMargin = Math.max((int) (width * edgeExclusionRatio), MIN_EDGE_MARGIN);
        double[] cumulative = cumulativeSum(smoothed);
        double total = cumulative[width - 1];
        if (edgeMargin * 2 >= width) {
            return SplitCandidate.none(edgeMargin, total);
        }

        int start = edgeMargin;
        int end = width - edgeMargin;

        List<Integer> candidates = collectValleys(smoothed, start, end);
        if (candidates.isEmpty()) {
            candidates.add(argMin(smoothed, start, end));
        }

        double maxVal = max(smoothed, start, end);

        int bestIdx = candidates.get(0);
        double bestScore = Double.POSITIVE_INFINITY;
        for (int idx : candidates) {
            double balanceScore = Math.abs(cumulative[idx] / (total + EPS) - TARGET_BALANCE);
            double depthScore = smoothed[idx] / (maxVal + EPS);
            double score = balanceScore + DEPTH_WEIGHT * depthScore;
            if (score < bestScore) {
                bestScore = score;
                bestIdx = idx;
            }
        }

        double confidence = (maxVal - smoothed[bestIdx]) / (maxVal + EPS);
        confidence = Math.max(0.0, Math.min(1.0, confidence));

        double leftMass = cumulative[bestIdx];
        double rightMass = total - leftMass;
        double imbalance = Math.abs(leftMass - rightMass) / (total + EPS);

        return new SplitCandidate(bestIdx, confidence, imbalance, edgeMargin, total);
    }

    /**
     * Indices {@code i} in {@code [max(start, 1), min(end, n - 1))} that are no higher
     * than either neighbour. Plateaus therefore contribute every interior sample.
     */
    static List<Integer> collectValleys(double[] data, int start, int end) {
        List<Integer> valleys = new ArrayList<>();
        int upper = Math.min(end, data.length - 1);
        for (int i = Math.max(start, 1); i < upper; i++) {
            if (data[i] <= data[i - 1] && data[i] <= data[i + 1]) {
                valleys.add(i);
            }
        }
        return valleys;
    }

    /**
     * 1-D Gaussian smoothing with replicated borders. Kernel size is
     * {@code round(8 * sigma + 1)} forced odd.
     */
    static double[] smooth(double[] data, double sigma) {
        int size = ((int) Math.round(sigma * 8 + 1)) | 1;
        int radius = size / 2;
        double[] kernel = new double[size];
        double scale = -0.5 / (sigma * sigma);
        double sum = 0;
        for (int i = 0; i < size; i++) {
            double x = i - radius;
            kernel[i] = Math.exp(scale * x * x);
            sum += kernel[i];
        }
        for (int i = 0; i < size; i++) {
            kernel[i] /= sum;
        }

        int n = data.length;
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            double acc = 0;
            for (int k = 0; k < size; k++) {
                int j = Math.max(0, Math.min(n - 1, i + k - radius));
                acc += data[j] * kernel[k];
            }
            out[i] = acc;
        }
        return out;
    }

    private static double[] cumulativeSum(double[] data) {
        double[] out = new double[data.length];
        double sum = 0;
        for (int i = 0; i < data.length; i++) {
            sum += data[i];
            out[i] = sum;
        }
        return out;
    }

    private static int argMin(double[] data, int start, int end) {
        int idx = start;
        for (int i = start + 1; i < end; i++) {
            if (data[i] < data[idx]) {
                idx = i;
            }
        }
        return idx;
    }

    private static double max(double[] data, int start, int end) {
        double m = Double.NEGATIVE_INFINITY;
        for (int i = start; i < end; i++) {
            if (data[i] > m) {
                m = data[i];
            }
        }
        return m;
    }
}
