package com.flowmable.splitter;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command line entry point: splits every spread under a file or directory.
 * <p>
 * Exit codes: 0 on success (warnings included), 2 on usage or run-level errors.
 */
@Command(
        name = "doublepage-split",
        mixinStandardHelpOptions = true,
        version = "doublepage-split " + SplitConfig.SPLIT_MODEL_VERSION,
        description = "Content-aware double page splitter for scanned manga spreads."
)
public class SplitDriver implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 2;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Image file or directory to process.")
    private Path input;

    @Option(names = "--output", defaultValue = "split-output",
            description = "Directory to write processed images and reports (default: ${DEFAULT-VALUE}).")
    private Path output;

    @Option(names = "--padding-ratio", description = "Extra padding applied when cropping (fraction of dimension).")
    private Double paddingRatio;

    @Option(names = "--cover-threshold", description = "Maximum content width ratio to classify as cover.")
    private Double coverThreshold;

    @Option(names = "--confidence-threshold", description = "Minimum valley contrast required to accept the smart split.")
    private Double confidenceThreshold;

    @Option(names = "--edge-exclusion", description = "Fraction of width to ignore near edges when searching for valleys.")
    private Double edgeExclusion;

    @Option(names = "--min-foreground", description = "Skip images with less foreground than this ratio.")
    private Double minForeground;

    @Option(names = "--overwrite", description = "Overwrite output files if they already exist.")
    private boolean overwrite;

    @Option(names = "--dry-run", description = "Run analysis without writing image outputs.")
    private boolean dryRun;

    @Option(names = "--report", description = "Path for the JSON report (default: <output>/split-report.json).")
    private Path report;

    @Option(names = "--threads", defaultValue = "1", description = "Worker threads (default: ${DEFAULT-VALUE}).")
    private int threads;

    @Option(names = "--estimate", description = "Only count spread-shaped images; nothing is split or written.")
    private boolean estimate;

    public static void main(String[] args) {
        System.exit(new CommandLine(new SplitDriver()).execute(args));
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        SplitConfig config;
        SplitBatchOptions options;
        try {
            config = SplitConfig.DEFAULT.withOverrides(new SplitThresholdOverrides(
                    paddingRatio, coverThreshold, confidenceThreshold, edgeExclusion, minForeground));
            options = new SplitBatchOptions(
                    input.toAbsolutePath().normalize(),
                    output.toAbsolutePath().normalize(),
                    report != null ? report.toAbsolutePath().normalize() : null,
                    overwrite, dryRun, threads);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }

        SplitBatchRunner runner = new SplitBatchRunner(new DoublePageSplitter(config));
        try {
            if (estimate) {
                SplitEstimate result = runner.estimateCandidates(options.input(), options.outputDir());
                out.printf("%d of %d image(s) look like spreads.%n", result.candidates(), result.total());
                return EXIT_OK;
            }

            SplitReport result = runner.run(options);
            SplitBatchSummary summary = result.summary();
            out.printf("Processed %d file(s): %d split (%d fallback), %d cover, %d skipped, %d written.%n",
                    summary.analyzedFiles(), summary.splitPages(), summary.fallbackSplits(),
                    summary.coverTrims(), summary.skippedFiles(), summary.emittedFiles());
            for (String warning : summary.warnings()) {
                err.println("[warn] " + warning);
            }
            out.println("Report: " + options.resolvedReportPath());
            return EXIT_OK;
        } catch (SplitBatchException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }
}
