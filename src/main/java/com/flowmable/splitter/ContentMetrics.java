package com.flowmable.splitter;

/**
 * Stage 2: content geometry derived from a non-empty foreground mask.
 *
 * @param boundingBox       Tight box around all foreground cells
 * @param foregroundRatio   Fraction of cells that are foreground [0, 1]
 * @param contentWidthRatio Box width / image width
 * @param bboxHeightRatio   Box height / image height
 */
public record ContentMetrics(
        BoundingBox boundingBox,
        double foregroundRatio,
        double contentWidthRatio,
        double bboxHeightRatio
) {

    /**
     * @throws IllegalStateException if the mask has no foreground; callers check
     *                               {@link ForegroundMask#isEmpty()} first
     */
    public static ContentMetrics measure(ForegroundMask mask) {
        BoundingBox bbox = mask.boundingBox();
        if (bbox == null) {
            throw new IllegalStateException("no foreground: content metrics need at least one ink cell");
        }
        return new ContentMetrics(
                bbox,
                mask.foregroundRatio(),
                (double) bbox.width() / mask.width(),
                (double) bbox.height() / mask.height()
        );
    }
}
