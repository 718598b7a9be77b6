package com.flowmable.splitter;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end scenarios on synthetic spreads: white paper with solid ink blocks.
 */
class DoublePageSplitterTest {

    private final DoublePageSplitter splitter = new DoublePageSplitter();

    // --- Synthetic Image Generators ---

    /** Blank white page of the given size. */
    static BufferedImage canvas(int width, int height) {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int white = 0xFFFFFF;
        for (int y = 0; y < height; y++)
            for (int x = 0; x < width; x++)
                img.setRGB(x, y, white);
        return img;
    }

    /** Fill the inclusive rectangle [x0, x1] x [y0, y1] with a gray level. */
    static BufferedImage fillRect(BufferedImage img, int x0, int y0, int x1, int y1, int gray) {
        int rgb = (gray << 16) | (gray << 8) | gray;
        for (int y = y0; y <= y1; y++)
            for (int x = x0; x <= x1; x++)
                img.setRGB(x, y, rgb);
        return img;
    }

    /** Two dense panels with a clear gutter near the center. */
    static BufferedImage twoPanelSpread() {
        BufferedImage img = canvas(800, 400);
        fillRect(img, 40, 40, 360, 360, 0);
        fillRect(img, 440, 40, 760, 360, 0);
        return img;
    }

    /** Narrow, nearly full-height artwork centered on a wide canvas. */
    static BufferedImage centeredCover() {
        return fillRect(canvas(900, 420), 370, 40, 530, 380, 30);
    }

    /** One wide block with no gutter anywhere. */
    static BufferedImage panorama() {
        return fillRect(canvas(820, 400), 40, 40, 780, 360, 0);
    }

    static BufferedImage toGray(BufferedImage src) {
        BufferedImage gray = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
        gray.getGraphics().drawImage(src, 0, 0, null);
        return gray;
    }

    /** Mean luminance of columns [x0, x1) of a page. */
    private static double meanGray(RasterImage page, int x0, int x1) {
        int[] gray = page.luminance();
        double sum = 0;
        int n = 0;
        for (int y = 0; y < page.height(); y++) {
            for (int x = x0; x < x1; x++) {
                sum += gray[y * page.width() + x];
                n++;
            }
        }
        return sum / n;
    }

    // --- Mode scenarios ---

    @Test
    void squareImage_skippedOnAspectRatio() {
        BufferedImage img = fillRect(canvas(400, 400), 40, 40, 360, 360, 0);
        SplitResult result = splitter.split(img);

        assertEquals(SplitMode.SKIP, result.mode());
        assertEquals("aspect_ratio", result.metadata().get("reason"));
        assertTrue(result.pages().isEmpty());
        assertNull(result.splitX());
        assertEquals(0.0, result.confidence());
    }

    @Test
    void blankSpread_skippedForNoForeground() {
        SplitResult result = splitter.split(canvas(800, 400));

        assertEquals(SplitMode.SKIP, result.mode());
        assertEquals("no_foreground", result.metadata().get("reason"));
        assertEquals(0.0, (double) result.metadata().get("foreground_ratio"), 1e-9);
        assertTrue(result.pages().isEmpty());
    }

    @Test
    void centeredCover_trimmedToSinglePage() {
        BufferedImage img = centeredCover();
        SplitResult result = splitter.split(img);

        assertEquals(SplitMode.COVER_TRIM, result.mode(),
                () -> "Expected cover-trim, metadata: " + result.metadata());
        assertNull(result.splitX());
        assertEquals(1.0, result.confidence());
        assertEquals(1, result.pages().size());

        RasterImage cover = result.pages().get(0);
        assertTrue(cover.width() < img.getWidth() * 0.6, "Cover width: " + cover.width());
        assertTrue(cover.height() >= img.getHeight() * 0.75, "Cover height: " + cover.height());
        assertEquals("cover-trim", result.metadata().get("splitMode"));
        assertTrue(result.contentWidthRatio() < SplitConfig.DEFAULT.coverContentRatio());
    }

    @Test
    void twoPanelSpread_splitInGutterRightPageFirst() {
        SplitResult result = splitter.split(twoPanelSpread());

        assertEquals(SplitMode.SPLIT, result.mode(),
                () -> "Expected split, metadata: " + result.metadata());
        assertNotNull(result.splitX());
        assertTrue(result.splitX() >= 360 && result.splitX() <= 460, "split_x = " + result.splitX());
        assertTrue(result.confidence() >= SplitConfig.DEFAULT.confidenceThreshold());
        assertEquals(2, result.pages().size());

        RasterImage right = result.pages().get(0);
        RasterImage left = result.pages().get(1);
        // Outer edges carry ink: right page on its right, left page on its left
        assertTrue(meanGray(right, right.width() - 20, right.width()) < 240);
        assertTrue(meanGray(left, 0, 20) < 240);

        assertEquals("projection", result.metadata().get("splitStrategy"));
        assertEquals(result.splitX(), result.metadata().get("split_x"));
        assertTrue(result.metadata().containsKey("projection_imbalance"));
    }

    @Test
    void panorama_fallsBackToCenter() {
        BufferedImage img = panorama();
        SplitResult result = splitter.split(img);

        assertEquals(SplitMode.FALLBACK_CENTER, result.mode(),
                () -> "Expected fallback, metadata: " + result.metadata());
        assertEquals(img.getWidth() / 2, result.splitX());
        assertEquals(2, result.pages().size());

        int rightWidth = result.pages().get(0).width();
        int leftWidth = result.pages().get(1).width();
        assertTrue(Math.abs(rightWidth - leftWidth) <= 4,
                "Page widths should be near equal: right=" + rightWidth + ", left=" + leftWidth);
        assertEquals("fallbackCenter", result.metadata().get("splitStrategy"));
        assertTrue(result.confidence() >= 0.0 && result.confidence() < SplitConfig.DEFAULT.confidenceThreshold());
    }

    // --- Properties ---

    @Test
    void sameInput_producesIdenticalResults() {
        BufferedImage img = twoPanelSpread();
        SplitResult first = splitter.split(img);
        SplitResult second = splitter.split(img);

        assertEquals(first, second);
    }

    @Test
    void grayscaleInput_matchesColorDecision() {
        SplitResult color = splitter.split(twoPanelSpread());
        SplitResult gray = splitter.split(toGray(twoPanelSpread()));

        assertEquals(color.mode(), gray.mode());
        assertEquals(color.splitX(), gray.splitX());
        assertEquals(1, gray.pages().get(0).channels());
    }

    @Test
    void inputImage_isNotModified() {
        BufferedImage img = twoPanelSpread();
        RasterImage raster = RasterImage.fromBufferedImage(img);
        RasterImage copy = RasterImage.fromBufferedImage(img);

        splitter.split(raster);

        assertEquals(copy, raster);
    }

    @Test
    void splitMetadata_carriesBoundingBox() {
        SplitResult result = splitter.split(twoPanelSpread());

        @SuppressWarnings("unchecked")
        Map<String, Object> bbox = (Map<String, Object>) result.metadata().get("bbox");
        assertNotNull(bbox);
        int x = (int) bbox.get("x");
        int width = (int) bbox.get("width");
        assertTrue(Math.abs(x - 40) <= 2, "bbox x = " + x);
        assertTrue(Math.abs(x + width - 761) <= 2, "bbox right = " + (x + width));
    }

    @Test
    void splitMetadata_isReadOnly() {
        SplitResult result = splitter.split(twoPanelSpread());

        @SuppressWarnings("unchecked")
        Map<String, Object> bbox = (Map<String, Object>) result.metadata().get("bbox");
        assertThrows(UnsupportedOperationException.class, () -> bbox.put("x", -999));
        assertThrows(UnsupportedOperationException.class, () -> result.metadata().put("split_x", 0));
        assertThrows(UnsupportedOperationException.class, () -> result.pages().clear());
        assertEquals(splitter.split(twoPanelSpread()), result);
    }

    @Test
    void strictCoverThreshold_disablesCoverTrim() {
        SplitConfig config = SplitConfig.DEFAULT.withOverrides(
                new SplitThresholdOverrides(null, 0.1, null, null, null));
        SplitResult result = new DoublePageSplitter(config).split(centeredCover());

        assertTrue(result.mode().producesTwoPages(), "Got " + result.mode());
        assertEquals(2, result.pages().size());
    }

    @Test
    void malformedRaster_rejected() {
        assertThrows(InvalidInputException.class, () -> RasterImage.of(0, 10, 3, new byte[0]));
        assertThrows(InvalidInputException.class, () -> RasterImage.of(4, 4, 2, new byte[32]));
        assertThrows(InvalidInputException.class, () -> RasterImage.of(4, 4, 3, new byte[47]));
    }
}
