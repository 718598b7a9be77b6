package com.flowmable.splitter;

/**
 * Numeric routines over single-channel 8-bit buffers and boolean masks.
 * <p>
 * Buffers are row-major {@code int[]} holding values in [0, 255]. Every routine
 * allocates its output; inputs are never written.
 */
public final class GrayscaleOps {

    private GrayscaleOps() {}

    // 5x5 binomial kernel, separable: outer product of {1, 4, 6, 4, 1}, sum = 256
    private static final int[] BINOMIAL_5 = {1, 4, 6, 4, 1};

    private static final float FLT_EPSILON = 1.1920929E-7f;

    /**
     * 5x5 Gaussian blur with the kernel implied by a zero sigma. Borders mirror
     * without repeating the edge sample (reflect-101); results are rounded to nearest.
     */
    public static int[] gaussianBlur5x5(int[] input, int w, int h) {
        int[] horizontal = new int[w * h];
        for (int y = 0; y < h; y++) {
            int row = y * w;
            for (int x = 0; x < w; x++) {
                int sum = 0;
                for (int k = -2; k <= 2; k++) {
                    sum += input[row + reflect101(x + k, w)] * BINOMIAL_5[k + 2];
                }
                horizontal[row + x] = sum;
            }
        }

        int[] output = new int[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int sum = 0;
                for (int k = -2; k <= 2; k++) {
                    sum += horizontal[reflect101(y + k, h) * w + x] * BINOMIAL_5[k + 2];
                }
                output[y * w + x] = (sum + 128) >> 8;
            }
        }
        return output;
    }

    /**
     * Otsu's threshold over the 256-bin histogram. Maximizes between-class variance;
     * a single-valued image yields 0.
     */
    public static int otsuThreshold(int[] input) {
        int[] histogram = new int[256];
        for (int v : input) {
            histogram[v]++;
        }

        double scale = 1.0 / input.length;
        double mu = 0;
        for (int i = 0; i < 256; i++) {
            mu += i * (double) histogram[i];
        }
        mu *= scale;

        double q1 = 0;
        double mu1 = 0;
        double maxSigma = 0;
        int maxVal = 0;
        for (int i = 0; i < 256; i++) {
            double pi = histogram[i] * scale;
            mu1 *= q1;
            q1 += pi;
            double q2 = 1.0 - q1;

            if (Math.min(q1, q2) < FLT_EPSILON || Math.max(q1, q2) > 1.0 - FLT_EPSILON) {
                continue;
            }

            mu1 = (mu1 + i * pi) / q1;
            double mu2 = (mu - q1 * mu1) / q2;
            double sigma = q1 * q2 * (mu1 - mu2) * (mu1 - mu2);
            if (sigma > maxSigma) {
                maxSigma = sigma;
                maxVal = i;
            }
        }
        return maxVal;
    }

    /**
     * Inverted binarization: samples at or below {@code threshold} become foreground.
     */
    public static boolean[] thresholdInverted(int[] input, int threshold) {
        boolean[] out = new boolean[input.length];
        for (int i = 0; i < input.length; i++) {
            out[i] = input[i] <= threshold;
        }
        return out;
    }

    /**
     * Erosion with a {@code size x size} square element. Cells outside the mask
     * do not take part.
     */
    public static boolean[] erode(boolean[] mask, int w, int h, int size) {
        return squareFilter(mask, w, h, size, true);
    }

    /**
     * Dilation with a {@code size x size} square element. Cells outside the mask
     * do not take part.
     */
    public static boolean[] dilate(boolean[] mask, int w, int h, int size) {
        return squareFilter(mask, w, h, size, false);
    }

    /** Erode then dilate. */
    public static boolean[] open(boolean[] mask, int w, int h, int size) {
        return dilate(erode(mask, w, h, size), w, h, size);
    }

    /** Dilate then erode. */
    public static boolean[] close(boolean[] mask, int w, int h, int size) {
        return erode(dilate(mask, w, h, size), w, h, size);
    }

    /**
     * Mirror an out-of-range index back into {@code [0, n)} without repeating the
     * edge sample: {@code -1 -> 1}, {@code n -> n - 2}.
     */
    static int reflect101(int i, int n) {
        if (n == 1) {
            return 0;
        }
        int period = 2 * (n - 1);
        int m = Math.floorMod(i, period);
        return m < n ? m : period - m;
    }

    // Separable min/max filter, rows then columns, using running window counts.
    private static boolean[] squareFilter(boolean[] mask, int w, int h, int size, boolean erode) {
        int r = size / 2;
        boolean[] rows = new boolean[w * h];
        int[] prefix = new int[Math.max(w, h) + 1];

        for (int y = 0; y < h; y++) {
            int row = y * w;
            for (int x = 0; x < w; x++) {
                prefix[x + 1] = prefix[x] + (mask[row + x] ? 1 : 0);
            }
            for (int x = 0; x < w; x++) {
                int lo = Math.max(0, x - r);
                int hi = Math.min(w, x + r + 1);
                int hits = prefix[hi] - prefix[lo];
                rows[row + x] = erode ? hits == hi - lo : hits > 0;
            }
        }

        boolean[] out = new boolean[w * h];
        for (int x = 0; x < w; x++) {
            for (int y = 0; y < h; y++) {
                prefix[y + 1] = prefix[y] + (rows[y * w + x] ? 1 : 0);
            }
            for (int y = 0; y < h; y++) {
                int lo = Math.max(0, y - r);
                int hi = Math.min(h, y + r + 1);
                int hits = prefix[hi] - prefix[lo];
                out[y * w + x] = erode ? hits == hi - lo : hits > 0;
            }
        }
        return out;
    }
}
