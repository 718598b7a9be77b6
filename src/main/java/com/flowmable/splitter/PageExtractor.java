package com.flowmable.splitter;

import java.util.List;

/**
 * Stage 5: crops the final page images with safety padding.
 * <p>
 * Two-page output is always ordered right page first, then left page, matching
 * right-to-left reading order. Cropping never fails; all coordinates are clamped
 * into the image.
 */
public class PageExtractor {

    private final double paddingRatio;

    public PageExtractor(SplitConfig config) {
        this.paddingRatio = config.paddingRatio();
    }

    /** Padding in pixels for a dimension: at least one pixel. */
    public int padding(int dimension) {
        return Math.max(1, (int) (paddingRatio * dimension));
    }

    /** Crop a single cover page around its bounding box. */
    public RasterImage cropCover(RasterImage image, BoundingBox bbox) {
        return cropPadded(image, bbox);
    }

    /**
     * Split at {@code splitX} (clamped into {@code [1, width - 1]}) and crop each side
     * around its own content.
     *
     * @return {@code [right, left]}
     */
    public List<RasterImage> extractPages(RasterImage image, ForegroundMask mask, int splitX) {
        int width = mask.width();
        int x = Math.max(1, Math.min(width - 1, splitX));

        RasterImage right = cropPadded(image, sideBox(mask, x, width));
        RasterImage left = cropPadded(image, sideBox(mask, 0, x));
        return List.of(right, left);
    }

    /**
     * Content box of the mask restricted to columns {@code [xStart, xEnd)}. An empty
     * side degenerates to its full column span and the full height.
     */
    BoundingBox sideBox(ForegroundMask mask, int xStart, int xEnd) {
        int start = Math.max(0, Math.min(xStart, mask.width() - 1));
        int end = Math.max(start + 1, Math.min(xEnd, mask.width()));
        BoundingBox bbox = mask.boundingBox(start, end);
        if (bbox == null) {
            return new BoundingBox(start, 0, end, mask.height());
        }
        return bbox;
    }

    private RasterImage cropPadded(RasterImage image, BoundingBox bbox) {
        int padX = padding(image.width());
        int padY = padding(image.height());
        return image.crop(
                bbox.xMin() - padX,
                bbox.yMin() - padY,
                bbox.xMax() + padX,
                bbox.yMax() + padY
        );
    }
}
