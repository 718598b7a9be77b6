package com.flowmable.splitter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Top-level entry point for the double page split pipeline.
 * <p>
 * PIPELINE
 * 1. Mode gate on aspect ratio (no mask needed).
 * 2. Foreground mask.
 * 3. Classification: skip / cover-trim return early.
 * 4. Gutter search, or the center fallback.
 * 5. Page extraction, right page first.
 * <p>
 * Stateless: one instance may be shared across threads.
 */
public class DoublePageSplitter {

    private static final Logger log = LoggerFactory.getLogger(DoublePageSplitter.class);

    static final String STRATEGY_PROJECTION = "projection";
    static final String STRATEGY_FALLBACK_CENTER = "fallbackCenter";

    private final SplitConfig config;
    private final ForegroundMaskBuilder maskBuilder;
    private final ModeClassifier classifier;
    private final PageExtractor extractor;

    public DoublePageSplitter() {
        this(SplitConfig.DEFAULT);
    }

    public DoublePageSplitter(SplitConfig config) {
        this.config = config;
        this.maskBuilder = new ForegroundMaskBuilder();
        this.classifier = new ModeClassifier(config);
        this.extractor = new PageExtractor(config);
    }

    public SplitResult split(Path imageFile) throws IOException {
        BufferedImage image = ImageIO.read(imageFile.toFile());
        if (image == null) {
            throw new IOException("Failed to decode image: " + imageFile);
        }
        return split(image);
    }

    public SplitResult split(BufferedImage image) {
        return split(RasterImage.fromBufferedImage(image));
    }

    public SplitResult split(RasterImage image) {
        int width = image.width();
        int height = image.height();

        // 1. Not spread-shaped: skip before paying for the mask
        if (!classifier.isSpreadShaped(width, height)) {
            log.debug("Skipping {}x{} image: below aspect ratio {}", width, height, config.minAspectRatio());
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("reason", ModeDecision.REASON_ASPECT_RATIO);
            return SplitResult.skip(metadata);
        }

        // 2. Mask
        ForegroundMask mask = maskBuilder.build(image);

        // 3. Classify
        ModeDecision decision = classifier.classify(mask);
        Map<String, Object> metadata = new LinkedHashMap<>();

        if (decision.mode() == SplitMode.SKIP) {
            metadata.put("reason", decision.reason());
            if (ModeDecision.REASON_NO_FOREGROUND.equals(decision.reason())) {
                metadata.put("foreground_ratio", decision.foregroundRatio());
            }
            log.debug("Skipping {}x{} image: {}", width, height, decision.reason());
            return SplitResult.skip(metadata);
        }

        ContentMetrics metrics = decision.metrics();
        metadata.put("foreground_ratio", metrics.foregroundRatio());
        metadata.put("bbox", metrics.boundingBox().toMetadata());

        if (decision.mode() == SplitMode.COVER_TRIM) {
            RasterImage cover = extractor.cropCover(image, metrics.boundingBox());
            metadata.put("splitMode", SplitMode.COVER_TRIM.wireName());
            metadata.put("content_width_ratio", metrics.contentWidthRatio());
            metadata.put("bbox_height_ratio", metrics.bboxHeightRatio());
            log.debug("Cover trim: content width ratio {}", metrics.contentWidthRatio());
            return new SplitResult(SplitMode.COVER_TRIM, null, 1.0, metrics.contentWidthRatio(),
                    List.of(cover), metadata);
        }

        // 4. Split or fallback
        metadata.putAll(decision.candidate().toMetadata());
        int splitX = decision.splitX();
        List<RasterImage> pages = extractor.extractPages(image, mask, splitX);

        metadata.put("splitMode", decision.mode().wireName());
        metadata.put("split_x", splitX);
        metadata.put("confidence", decision.confidence());
        metadata.put("content_width_ratio", metrics.contentWidthRatio());
        metadata.put("bbox_height_ratio", metrics.bboxHeightRatio());
        metadata.put("splitStrategy", decision.mode() == SplitMode.SPLIT
                ? STRATEGY_PROJECTION : STRATEGY_FALLBACK_CENTER);

        log.debug("{} at x={} (confidence {})", decision.mode().wireName(), splitX, decision.confidence());
        return new SplitResult(decision.mode(), splitX, decision.confidence(), metrics.contentWidthRatio(),
                pages, metadata);
    }

    public SplitConfig config() {
        return config;
    }
}
