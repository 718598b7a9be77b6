package com.flowmable.splitter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Axis-aligned box with exclusive maxima.
 *
 * @param xMin first column inside the box
 * @param yMin first row inside the box
 * @param xMax column after the last one inside the box
 * @param yMax row after the last one inside the box
 */
public record BoundingBox(int xMin, int yMin, int xMax, int yMax) {

    public BoundingBox {
        if (xMin < 0 || yMin < 0 || xMin >= xMax || yMin >= yMax) {
            throw new IllegalArgumentException(
                    "Degenerate bounding box: (" + xMin + ", " + yMin + ", " + xMax + ", " + yMax + ")");
        }
    }

    public int width() {
        return xMax - xMin;
    }

    public int height() {
        return yMax - yMin;
    }

    /** Report form: {@code x, y, width, height}. */
    public Map<String, Object> toMetadata() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("x", xMin);
        out.put("y", yMin);
        out.put("width", width());
        out.put("height", height());
        return Collections.unmodifiableMap(out);
    }
}
