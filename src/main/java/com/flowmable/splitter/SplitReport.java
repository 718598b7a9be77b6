package com.flowmable.splitter;

import java.util.List;

/**
 * JSON report written at the end of a batch run.
 *
 * @param generatedAt ISO-8601 UTC timestamp
 * @param summary     Run counters
 * @param items       One entry per readable input, in input order
 */
public record SplitReport(
        String generatedAt,
        SplitBatchSummary summary,
        List<SplitReportItem> items
) {
    public SplitReport {
        items = List.copyOf(items);
    }
}
