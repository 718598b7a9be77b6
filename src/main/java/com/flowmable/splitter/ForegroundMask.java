package com.flowmable.splitter;

import java.util.Arrays;

/**
 * Boolean ink map with the same geometry as the analysed image.
 */
public final class ForegroundMask {

    private final int width;
    private final int height;
    private final boolean[] cells;

    ForegroundMask(int width, int height, boolean[] cells) {
        if (cells.length != width * height) {
            throw new IllegalArgumentException("Mask buffer does not match " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.cells = cells;
    }

    /**
     * Build a mask from a row-major copy of {@code cells}.
     */
    public static ForegroundMask of(int width, int height, boolean[] cells) {
        if (width <= 0 || height <= 0) {
            throw new InvalidInputException("Mask must have a positive area, got " + width + "x" + height);
        }
        return new ForegroundMask(width, height, cells.clone());
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public boolean get(int x, int y) {
        return cells[y * width + x];
    }

    public int count() {
        int n = 0;
        for (boolean c : cells) {
            if (c) n++;
        }
        return n;
    }

    public boolean isEmpty() {
        for (boolean c : cells) {
            if (c) return false;
        }
        return true;
    }

    /** Mean of the mask as a fraction of all cells. */
    public double foregroundRatio() {
        return (double) count() / cells.length;
    }

    /**
     * Column projection: number of foreground cells in each column.
     */
    public double[] columnProjection() {
        double[] projection = new double[width];
        for (int y = 0; y < height; y++) {
            int row = y * width;
            for (int x = 0; x < width; x++) {
                if (cells[row + x]) {
                    projection[x] += 1.0;
                }
            }
        }
        return projection;
    }

    /**
     * Tight box around all foreground cells in columns {@code [xStart, xEnd)}.
     *
     * @return the box, or {@code null} when the slice holds no foreground
     */
    public BoundingBox boundingBox(int xStart, int xEnd) {
        int x0 = Math.max(0, xStart);
        int x1 = Math.min(width, xEnd);
        int minX = Integer.MAX_VALUE, minY = Integer.MAX_VALUE;
        int maxX = -1, maxY = -1;
        for (int y = 0; y < height; y++) {
            int row = y * width;
            for (int x = x0; x < x1; x++) {
                if (!cells[row + x]) continue;
                if (x < minX) minX = x;
                if (x > maxX) maxX = x;
                if (y < minY) minY = y;
                if (y > maxY) maxY = y;
            }
        }
        if (maxX < 0) {
            return null;
        }
        return new BoundingBox(minX, minY, maxX + 1, maxY + 1);
    }

    /** Tight box around every foreground cell, or {@code null} for an empty mask. */
    public BoundingBox boundingBox() {
        return boundingBox(0, width);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ForegroundMask other)) return false;
        return width == other.width && height == other.height && Arrays.equals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(cells);
    }
}
