package com.flowmable.splitter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Input discovery for the batch driver.
 */
public final class ImageFiles {

    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".png", ".jpg", ".jpeg", ".webp");

    private ImageFiles() {
    }

    public static boolean isSupported(Path path) {
        String extension = extension(path);
        return extension != null && SUPPORTED_EXTENSIONS.contains(extension.toLowerCase(Locale.ROOT));
    }

    /**
     * A supported file yields itself; a directory is walked recursively in path order.
     * Anything under {@code excludeDir} is left out so earlier outputs are never re-split.
     */
    public static List<Path> collect(Path input, Path excludeDir) throws IOException {
        if (Files.isRegularFile(input)) {
            return isSupported(input) ? List.of(input) : List.of();
        }
        Path excluded = excludeDir != null ? excludeDir.toAbsolutePath().normalize() : null;
        try (Stream<Path> walk = Files.walk(input)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(ImageFiles::isSupported)
                    .filter(p -> excluded == null || !p.toAbsolutePath().normalize().startsWith(excluded))
                    .sorted()
                    .toList();
        }
    }

    /** File name without its last extension. */
    public static String stem(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /** Last extension including the dot, or null when the name has none. */
    public static String extension(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot) : null;
    }
}
