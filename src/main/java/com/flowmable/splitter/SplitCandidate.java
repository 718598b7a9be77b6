package com.flowmable.splitter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gutter proposal from {@link SplitLocator}.
 *
 * @param splitX     Column of the chosen valley, or {@code null} when no candidate exists
 * @param confidence Relative depth of the chosen valley [0, 1]
 * @param imbalance  |left mass - right mass| / total mass at the chosen column
 * @param edgeMargin Columns excluded at each edge; 0 when the search never got that far
 * @param totalMass  Sum of the smoothed projection; 0 when the search never got that far
 */
public record SplitCandidate(
        Integer splitX,
        double confidence,
        double imbalance,
        int edgeMargin,
        double totalMass
) {

    static SplitCandidate none() {
        return new SplitCandidate(null, 0.0, 0.0, 0, 0.0);
    }

    static SplitCandidate none(int edgeMargin, double totalMass) {
        return new SplitCandidate(null, 0.0, 0.0, edgeMargin, totalMass);
    }

    public boolean found() {
        return splitX != null;
    }

    public Map<String, Object> toMetadata() {
        Map<String, Object> out = new LinkedHashMap<>();
        if (found()) {
            out.put("projection_imbalance", imbalance);
        }
        if (edgeMargin > 0) {
            out.put("projection_edge_margin", edgeMargin);
            out.put("projection_total_mass", totalMass);
        }
        return Collections.unmodifiableMap(out);
    }
}
