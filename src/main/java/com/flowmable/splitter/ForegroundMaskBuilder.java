package com.flowmable.splitter;

/**
 * Stage 1: converts a spread into a binary ink mask.
 * <p>
 * Steps, in order:
 * 1. Luminance (gray input used as-is).
 * 2. 5x5 Gaussian blur, zero sigma.
 * 3. CLAHE, clip limit 2.0, 8x8 tiles.
 * 4. Otsu threshold, inverted: dark ink is foreground, paper is background.
 * 5. Opening then closing with a 5x5 square, one pass each, to drop speckle and
 *    bridge hairline gaps.
 * <p>
 * Deterministic and side-effect free. Always returns a mask, possibly empty.
 */
public class ForegroundMaskBuilder {

    private static final double CLAHE_CLIP_LIMIT = 2.0;
    private static final int CLAHE_TILES = 8;
    private static final int MORPH_KERNEL = 5;

    private final Clahe clahe = new Clahe(CLAHE_CLIP_LIMIT, CLAHE_TILES, CLAHE_TILES);

    public ForegroundMask build(RasterImage image) {
        int w = image.width();
        int h = image.height();

        // 1-3. Normalize
        int[] gray = image.luminance();
        int[] blurred = GrayscaleOps.gaussianBlur5x5(gray, w, h);
        int[] equalized = clahe.apply(blurred, w, h);

        // 4. Binarize
        int threshold = GrayscaleOps.otsuThreshold(equalized);
        boolean[] binary = GrayscaleOps.thresholdInverted(equalized, threshold);

        // 5. Clean up
        boolean[] opened = GrayscaleOps.open(binary, w, h, MORPH_KERNEL);
        boolean[] cleaned = GrayscaleOps.close(opened, w, h, MORPH_KERNEL);

        return new ForegroundMask(w, h, cleaned);
    }
}
