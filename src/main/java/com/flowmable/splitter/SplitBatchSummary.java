package com.flowmable.splitter;

import java.util.List;

/**
 * Counters for one batch run.
 *
 * @param analyzedFiles  Supported files attempted, readable or not
 * @param emittedFiles   Page images actually written
 * @param skippedFiles   Skip results plus unreadable files
 * @param splitPages     Two-page results, fallbacks included
 * @param coverTrims     Cover results
 * @param fallbackSplits Two-page results that fell back to the center
 * @param warnings       Per-file problems, in input order
 */
public record SplitBatchSummary(
        int analyzedFiles,
        int emittedFiles,
        int skippedFiles,
        int splitPages,
        int coverTrims,
        int fallbackSplits,
        List<String> warnings
) {
    public SplitBatchSummary {
        warnings = List.copyOf(warnings);
    }
}
