package com.flowmable.splitter;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Output file names for a split result: {@code <stem>_cover<ext>} for covers,
 * {@code <stem>_R<ext>} then {@code <stem>_L<ext>} for two-page results.
 * A source without an extension is written as PNG.
 */
public final class OutputNaming {

    static final String DEFAULT_EXTENSION = ".png";

    private OutputNaming() {
    }

    public static List<String> names(Path source, SplitMode mode) {
        String stem = ImageFiles.stem(source);
        String extension = ImageFiles.extension(source);
        if (extension == null) {
            extension = DEFAULT_EXTENSION;
        }
        return switch (mode) {
            case SKIP -> List.of();
            case COVER_TRIM -> List.of(stem + "_cover" + extension);
            case SPLIT, FALLBACK_CENTER -> List.of(stem + "_R" + extension, stem + "_L" + extension);
        };
    }

    /** ImageIO format name for a file name, by extension. */
    static String formatName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        String extension = dot >= 0 ? fileName.substring(dot + 1).toLowerCase(Locale.ROOT) : "png";
        return switch (extension) {
            case "jpg", "jpeg" -> "jpeg";
            default -> extension;
        };
    }
}
