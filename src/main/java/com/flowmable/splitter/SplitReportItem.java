package com.flowmable.splitter;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * One report row per analyzed image.
 *
 * @param source            Absolute path of the input image
 * @param mode              Outcome, written as its wire name
 * @param splitX            Split column; null unless two pages were produced
 * @param confidence        Outcome confidence [0, 1]
 * @param contentWidthRatio Content width / image width
 * @param outputs           File names written into the output directory (empty on dry runs)
 * @param metadata          Diagnostics from {@link SplitResult#metadata()}
 */
public record SplitReportItem(
        String source,
        SplitMode mode,
        @JsonProperty("split_x") Integer splitX,
        double confidence,
        @JsonProperty("content_width_ratio") double contentWidthRatio,
        List<String> outputs,
        Map<String, Object> metadata
) {
    public SplitReportItem {
        outputs = List.copyOf(outputs);
    }

    static SplitReportItem of(Path source, SplitResult result, List<String> outputs) {
        return new SplitReportItem(
                source.toAbsolutePath().normalize().toString(),
                result.mode(),
                result.splitX(),
                result.confidence(),
                result.contentWidthRatio(),
                outputs,
                result.metadata()
        );
    }
}
