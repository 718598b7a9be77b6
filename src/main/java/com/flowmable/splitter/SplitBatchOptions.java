package com.flowmable.splitter;

import java.nio.file.Path;

/**
 * Options for a {@link SplitBatchRunner} run.
 *
 * @param input      Image file or directory
 * @param outputDir  Directory receiving page images
 * @param reportPath JSON report location; null means {@code <outputDir>/split-report.json}
 * @param overwrite  Replace existing output files instead of warning
 * @param dryRun     Analyze only; the report is still written
 * @param threads    Worker threads, at least 1
 */
public record SplitBatchOptions(
        Path input,
        Path outputDir,
        Path reportPath,
        boolean overwrite,
        boolean dryRun,
        int threads
) {
    public static final String DEFAULT_REPORT_NAME = "split-report.json";

    public SplitBatchOptions {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1, got: " + threads);
        }
    }

    public Path resolvedReportPath() {
        return reportPath != null ? reportPath : outputDir.resolve(DEFAULT_REPORT_NAME);
    }
}
