package com.flowmable.splitter;

/**
 * Contrast Limited Adaptive Histogram Equalization for 8-bit gray buffers.
 * <p>
 * The image is divided into a grid of tiles. Each tile gets an equalization LUT
 * built from its histogram, clipped at {@code clipLimit} times the mean bin
 * height with the excess spread back over all bins. Every output sample is a
 * bilinear blend of the LUTs of the four nearest tile centers.
 * <p>
 * When the image size is not a multiple of the grid, LUTs are estimated on a
 * copy extended to the next multiple with reflect-101 borders.
 */
public final class Clahe {

    private static final int BINS = 256;

    private final double clipLimit;
    private final int tilesX;
    private final int tilesY;

    public Clahe(double clipLimit, int tilesX, int tilesY) {
        if (tilesX <= 0 || tilesY <= 0) {
            throw new IllegalArgumentException("Tile grid must be positive, got " + tilesX + "x" + tilesY);
        }
        this.clipLimit = clipLimit;
        this.tilesX = tilesX;
        this.tilesY = tilesY;
    }

    public int[] apply(int[] src, int w, int h) {
        int extW = w;
        int extH = h;
        int[] lutSource = src;
        if (w % tilesX != 0 || h % tilesY != 0) {
            extW = w + tilesX - (w % tilesX);
            extH = h + tilesY - (h % tilesY);
            lutSource = extendReflect101(src, w, h, extW, extH);
        }

        int tileW = extW / tilesX;
        int tileH = extH / tilesY;
        int[][] luts = buildLuts(lutSource, extW, tileW, tileH);
        return interpolate(src, w, h, tileW, tileH, luts);
    }

    private int[][] buildLuts(int[] src, int stride, int tileW, int tileH) {
        int tileArea = tileW * tileH;
        float lutScale = (float) (BINS - 1) / tileArea;
        int clip = 0;
        if (clipLimit > 0.0) {
            clip = Math.max((int) (clipLimit * tileArea / BINS), 1);
        }

        int[][] luts = new int[tilesX * tilesY][];
        int[] hist = new int[BINS];
        for (int ty = 0; ty < tilesY; ty++) {
            for (int tx = 0; tx < tilesX; tx++) {
                java.util.Arrays.fill(hist, 0);
                for (int y = ty * tileH; y < (ty + 1) * tileH; y++) {
                    int row = y * stride;
                    for (int x = tx * tileW; x < (tx + 1) * tileW; x++) {
                        hist[src[row + x]]++;
                    }
                }

                if (clip > 0) {
                    redistribute(hist, clip);
                }

                int[] lut = new int[BINS];
                int sum = 0;
                for (int i = 0; i < BINS; i++) {
                    sum += hist[i];
                    lut[i] = saturate((float) sum * lutScale);
                }
                luts[ty * tilesX + tx] = lut;
            }
        }
        return luts;
    }

    private static void redistribute(int[] hist, int clip) {
        int clipped = 0;
        for (int i = 0; i < BINS; i++) {
            if (hist[i] > clip) {
                clipped += hist[i] - clip;
                hist[i] = clip;
            }
        }

        int batch = clipped / BINS;
        int residual = clipped - batch * BINS;
        for (int i = 0; i < BINS; i++) {
            hist[i] += batch;
        }
        if (residual != 0) {
            int step = Math.max(BINS / residual, 1);
            for (int i = 0; i < BINS && residual > 0; i += step, residual--) {
                hist[i]++;
            }
        }
    }

    private int[] interpolate(int[] src, int w, int h, int tileW, int tileH, int[][] luts) {
        float invTw = 1.0f / tileW;
        float invTh = 1.0f / tileH;

        int[] tx1 = new int[w];
        int[] tx2 = new int[w];
        float[] xa = new float[w];
        for (int x = 0; x < w; x++) {
            float txf = x * invTw - 0.5f;
            int t1 = (int) Math.floor(txf);
            xa[x] = txf - t1;
            tx1[x] = Math.max(t1, 0);
            tx2[x] = Math.min(t1 + 1, tilesX - 1);
        }

        int[] out = new int[w * h];
        for (int y = 0; y < h; y++) {
            float tyf = y * invTh - 0.5f;
            int ty1 = (int) Math.floor(tyf);
            float ya = tyf - ty1;
            float ya1 = 1.0f - ya;
            int ty2 = Math.min(ty1 + 1, tilesY - 1);
            ty1 = Math.max(ty1, 0);

            int plane1 = ty1 * tilesX;
            int plane2 = ty2 * tilesX;
            int row = y * w;
            for (int x = 0; x < w; x++) {
                int v = src[row + x];
                float xa1 = 1.0f - xa[x];
                float top = luts[plane1 + tx1[x]][v] * xa1 + luts[plane1 + tx2[x]][v] * xa[x];
                float bottom = luts[plane2 + tx1[x]][v] * xa1 + luts[plane2 + tx2[x]][v] * xa[x];
                out[row + x] = saturate(top * ya1 + bottom * ya);
            }
        }
        return out;
    }

    private static int[] extendReflect101(int[] src, int w, int h, int extW, int extH) {
        int[] out = new int[extW * extH];
        for (int y = 0; y < extH; y++) {
            int srcRow = GrayscaleOps.reflect101(y, h) * w;
            for (int x = 0; x < extW; x++) {
                out[y * extW + x] = src[srcRow + GrayscaleOps.reflect101(x, w)];
            }
        }
        return out;
    }

    private static int saturate(float v) {
        int r = (int) Math.rint(v);
        return Math.max(0, Math.min(255, r));
    }
}
