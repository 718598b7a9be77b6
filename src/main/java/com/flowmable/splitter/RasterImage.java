package com.flowmable.splitter;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.util.Arrays;

/**
 * Immutable 8-bit pixel grid, row-major, either single-channel gray or 3-channel BGR.
 * <p>
 * The pipeline never writes into an instance; {@link #crop} and the conversions
 * always return fresh buffers.
 */
public final class RasterImage {

    private final int width;
    private final int height;
    private final int channels;
    private final byte[] data;

    private RasterImage(int width, int height, int channels, byte[] data) {
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.data = data;
    }

    /**
     * Wrap a copy of the given buffer.
     *
     * @param data row-major samples, {@code width * height * channels} bytes, BGR order for color
     * @throws InvalidInputException if the geometry is empty or does not match the buffer
     */
    public static RasterImage of(int width, int height, int channels, byte[] data) {
        if (width <= 0 || height <= 0) {
            throw new InvalidInputException("Image must have a positive area, got " + width + "x" + height);
        }
        if (channels != 1 && channels != 3) {
            throw new InvalidInputException("Expected 1 (gray) or 3 (BGR) channels, got " + channels);
        }
        if (data == null || (long) width * height * channels != data.length) {
            throw new InvalidInputException("Pixel buffer of " + (data == null ? 0 : data.length)
                    + " bytes does not match " + width + "x" + height + "x" + channels);
        }
        return new RasterImage(width, height, channels, data.clone());
    }

    /**
     * Convert a decoded image. Gray images stay single-channel; everything else
     * becomes BGR with alpha dropped.
     */
    public static RasterImage fromBufferedImage(BufferedImage image) {
        if (image == null) {
            throw new InvalidInputException("Image is null");
        }
        int w = image.getWidth();
        int h = image.getHeight();
        if (w <= 0 || h <= 0) {
            throw new InvalidInputException("Image must have a positive area, got " + w + "x" + h);
        }

        if (image.getType() == BufferedImage.TYPE_BYTE_GRAY) {
            byte[] gray = new byte[w * h];
            image.getRaster().getDataElements(0, 0, w, h, gray);
            return new RasterImage(w, h, 1, gray);
        }

        byte[] bgr = new byte[w * h * 3];
        int[] row = new int[w];
        for (int y = 0; y < h; y++) {
            image.getRGB(0, y, w, 1, row, 0, w);
            int offset = y * w * 3;
            for (int x = 0; x < w; x++) {
                int argb = row[x];
                bgr[offset + x * 3] = (byte) (argb & 0xFF);
                bgr[offset + x * 3 + 1] = (byte) ((argb >> 8) & 0xFF);
                bgr[offset + x * 3 + 2] = (byte) ((argb >> 16) & 0xFF);
            }
        }
        return new RasterImage(w, h, 3, bgr);
    }

    public BufferedImage toBufferedImage() {
        int type = channels == 1 ? BufferedImage.TYPE_BYTE_GRAY : BufferedImage.TYPE_3BYTE_BGR;
        BufferedImage out = new BufferedImage(width, height, type);
        byte[] target = ((DataBufferByte) out.getRaster().getDataBuffer()).getData();
        System.arraycopy(data, 0, target, 0, data.length);
        return out;
    }

    /**
     * Single-channel luminance. Gray input is returned as a copy; BGR uses the
     * fixed-point BT.601 weights.
     */
    public int[] luminance() {
        int n = width * height;
        int[] gray = new int[n];
        if (channels == 1) {
            for (int i = 0; i < n; i++) {
                gray[i] = data[i] & 0xFF;
            }
            return gray;
        }
        for (int i = 0; i < n; i++) {
            int b = data[i * 3] & 0xFF;
            int g = data[i * 3 + 1] & 0xFF;
            int r = data[i * 3 + 2] & 0xFF;
            gray[i] = (b * 1868 + g * 9617 + r * 4899 + 8192) >> 14;
        }
        return gray;
    }

    /**
     * Copy of the region {@code [x0, x1) x [y0, y1)}. Coordinates are clamped into the
     * image; a region that collapses after clamping yields a copy of the whole image.
     */
    public RasterImage crop(int x0, int y0, int x1, int y1) {
        int cx0 = clamp(x0, 0, width - 1);
        int cy0 = clamp(y0, 0, height - 1);
        int cx1 = clamp(x1, 0, width);
        int cy1 = clamp(y1, 0, height);
        if (cx1 <= cx0 || cy1 <= cy0) {
            return new RasterImage(width, height, channels, data.clone());
        }

        int cw = cx1 - cx0;
        int ch = cy1 - cy0;
        byte[] out = new byte[cw * ch * channels];
        int rowBytes = cw * channels;
        for (int y = 0; y < ch; y++) {
            System.arraycopy(data, ((cy0 + y) * width + cx0) * channels, out, y * rowBytes, rowBytes);
        }
        return new RasterImage(cw, ch, channels, out);
    }

    /** Sample at (x, y) for the given channel, 0-255. */
    public int sample(int x, int y, int channel) {
        return data[(y * width + x) * channels + channel] & 0xFF;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int channels() {
        return channels;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RasterImage other)) return false;
        return width == other.width
                && height == other.height
                && channels == other.channels
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(width);
        result = 31 * result + Integer.hashCode(height);
        result = 31 * result + Integer.hashCode(channels);
        result = 31 * result + Arrays.hashCode(data);
        return result;
    }

    @Override
    public String toString() {
        return "RasterImage[" + width + "x" + height + "x" + channels + "]";
    }

    private static int clamp(int v, int lo, int hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
