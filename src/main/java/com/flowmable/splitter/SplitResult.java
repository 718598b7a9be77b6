package com.flowmable.splitter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of splitting one spread.
 *
 * @param mode              Outcome classification
 * @param splitX            Split column for two-page modes; null otherwise
 * @param confidence        Trust in the outcome [0, 1]; 1.0 for covers, 0.0 for skips
 * @param contentWidthRatio Content bounding box width / image width; 0.0 for skips
 * @param pages             0 pages (skip), 1 (cover), or 2 ordered right then left
 * @param metadata          Diagnostics: numbers, strings, booleans and nested maps only
 */
public record SplitResult(
        SplitMode mode,
        Integer splitX,
        double confidence,
        double contentWidthRatio,
        List<RasterImage> pages,
        Map<String, Object> metadata
) {
    public SplitResult {
        pages = List.copyOf(pages);
        metadata = freeze(metadata);
    }

    static SplitResult skip(Map<String, Object> metadata) {
        return new SplitResult(SplitMode.SKIP, null, 0.0, 0.0, List.of(), metadata);
    }

    // Nested maps are frozen as well
    private static Map<String, Object> freeze(Map<String, Object> metadata) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : metadata.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> nested) {
                @SuppressWarnings("unchecked")
                Map<String, Object> inner = (Map<String, Object>) nested;
                value = freeze(inner);
            }
            copy.put(entry.getKey(), value);
        }
        return Collections.unmodifiableMap(copy);
    }
}
