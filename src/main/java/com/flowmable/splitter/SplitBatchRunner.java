package com.flowmable.splitter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the splitter over a file or directory tree, writes the page images and a JSON report.
 * <p>
 * Files are analyzed on a fixed pool of {@code threads} workers; report items and warnings
 * keep input order regardless of completion order. Each output name is claimed once per run,
 * so same-stem sources from different directories never overwrite each other.
 */
public class SplitBatchRunner {

    private static final Logger log = LoggerFactory.getLogger(SplitBatchRunner.class);

    private final DoublePageSplitter splitter;
    private final ObjectMapper mapper;

    public SplitBatchRunner(DoublePageSplitter splitter) {
        this.splitter = splitter;
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public SplitReport run(SplitBatchOptions options) throws SplitBatchException {
        List<Path> sources = discover(options.input(), options.outputDir());
        log.info("Splitting {} file(s) from {} into {}", sources.size(), options.input(), options.outputDir());

        List<FileOutcome> outcomes = analyzeAll(sources, new Run(options, sources.size()));

        int emitted = 0;
        int skipped = 0;
        int splits = 0;
        int covers = 0;
        int fallbacks = 0;
        List<String> warnings = new ArrayList<>();
        List<SplitReportItem> items = new ArrayList<>();

        for (FileOutcome outcome : outcomes) {
            warnings.addAll(outcome.warnings());
            emitted += outcome.item() != null ? outcome.item().outputs().size() : 0;
            if (outcome.item() == null) {
                skipped++;
                continue;
            }
            items.add(outcome.item());
            switch (outcome.item().mode()) {
                case SKIP -> skipped++;
                case COVER_TRIM -> covers++;
                case SPLIT -> splits++;
                case FALLBACK_CENTER -> {
                    splits++;
                    fallbacks++;
                }
            }
        }

        SplitBatchSummary summary = new SplitBatchSummary(
                sources.size(), emitted, skipped, splits, covers, fallbacks, warnings);
        SplitReport report = new SplitReport(
                Instant.now().truncatedTo(ChronoUnit.MILLIS).toString(), summary, items);

        writeReport(report, options.resolvedReportPath());
        log.info("Analyzed {} file(s): {} split, {} cover, {} skipped, {} warning(s)",
                summary.analyzedFiles(), summary.splitPages(), summary.coverTrims(),
                summary.skippedFiles(), warnings.size());
        return report;
    }

    /**
     * Counts supported files whose header dimensions pass the aspect gate, without decoding pixels.
     * Files whose dimensions cannot be read count towards the total only.
     */
    public SplitEstimate estimateCandidates(Path input, Path excludeDir) throws SplitBatchException {
        List<Path> sources = discover(input, excludeDir);
        ModeClassifier gate = new ModeClassifier(splitter.config());
        int candidates = 0;
        for (Path source : sources) {
            int[] dimensions = readDimensions(source);
            if (dimensions != null && gate.isSpreadShaped(dimensions[0], dimensions[1])) {
                candidates++;
            }
        }
        return new SplitEstimate(sources.size(), candidates);
    }

    private List<Path> discover(Path input, Path excludeDir) throws SplitBatchException {
        if (input == null || !Files.exists(input)) {
            throw new SplitBatchException("Input path does not exist: " + input);
        }
        List<Path> sources;
        try {
            sources = ImageFiles.collect(input, excludeDir);
        } catch (IOException e) {
            throw new SplitBatchException("Failed to list input: " + input, e);
        }
        if (sources.isEmpty()) {
            throw new SplitBatchException("No supported images (png, jpg, jpeg, webp) under: " + input);
        }
        return sources;
    }

    private List<FileOutcome> analyzeAll(List<Path> sources, Run run) throws SplitBatchException {
        ExecutorService pool = Executors.newFixedThreadPool(run.options().threads());
        try {
            List<Future<FileOutcome>> futures = new ArrayList<>(sources.size());
            for (Path source : sources) {
                futures.add(pool.submit(() -> analyze(source, run)));
            }
            List<FileOutcome> outcomes = new ArrayList<>(sources.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    throw new SplitBatchException("Failed to split " + sources.get(i), e.getCause());
                }
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SplitBatchException("Interrupted while splitting", e);
        } finally {
            pool.shutdownNow();
        }
    }

    private FileOutcome analyze(Path source, Run run) {
        List<String> warnings = new ArrayList<>();
        BufferedImage image;
        try {
            image = ImageIO.read(source.toFile());
        } catch (IOException e) {
            image = null;
            log.debug("Decoder failed on {}", source, e);
        }
        if (image == null) {
            String warning = "Skipping unreadable image: " + source;
            log.warn(warning);
            warnings.add(warning);
            log.info("[{}/{}] {} -> unreadable", run.processed().incrementAndGet(), run.total(), source);
            return new FileOutcome(null, warnings);
        }

        SplitResult result = splitter.split(image);
        List<String> outputs = run.options().dryRun()
                ? List.of()
                : export(result, source, run, warnings);
        log.info("[{}/{}] {} -> {}", run.processed().incrementAndGet(), run.total(), source,
                result.mode().wireName());
        return new FileOutcome(SplitReportItem.of(source, result, outputs), warnings);
    }

    private List<String> export(SplitResult result, Path source, Run run, List<String> warnings) {
        SplitBatchOptions options = run.options();
        List<String> names = OutputNaming.names(source, result.mode());
        List<String> written = new ArrayList<>(names.size());
        for (int i = 0; i < names.size() && i < result.pages().size(); i++) {
            String name = names.get(i);
            Path target = options.outputDir().resolve(name);
            // Claim before the existence check: another worker may be writing the same name
            if (!run.claimedNames().add(name) || (Files.exists(target) && !options.overwrite())) {
                warn(warnings, "Output file already exists: " + target);
                continue;
            }
            try {
                Files.createDirectories(options.outputDir());
                String format = OutputNaming.formatName(name);
                if (!ImageIO.write(result.pages().get(i).toBufferedImage(), format, target.toFile())) {
                    warn(warnings, "No image writer for format '" + format + "': " + target);
                    continue;
                }
                written.add(name);
            } catch (IOException e) {
                warn(warnings, "Failed to write image: " + target + " (" + e.getMessage() + ")");
            }
        }
        return written;
    }

    private void writeReport(SplitReport report, Path reportPath) throws SplitBatchException {
        try {
            Path parent = reportPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(reportPath.toFile(), report);
        } catch (IOException e) {
            throw new SplitBatchException("Failed to write report: " + reportPath, e);
        }
    }

    private static int[] readDimensions(Path source) {
        try (ImageInputStream in = ImageIO.createImageInputStream(source.toFile())) {
            if (in == null) {
                return null;
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                return null;
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in);
                return new int[]{reader.getWidth(0), reader.getHeight(0)};
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            log.debug("Cannot read dimensions of {}", source, e);
            return null;
        }
    }

    private static void warn(List<String> warnings, String message) {
        log.warn(message);
        warnings.add(message);
    }

    private record FileOutcome(SplitReportItem item, List<String> warnings) {
    }

    private record Run(SplitBatchOptions options, Set<String> claimedNames, AtomicInteger processed, int total) {

        Run(SplitBatchOptions options, int total) {
            this(options, ConcurrentHashMap.newKeySet(), new AtomicInteger(), total);
        }
    }
}
