package com.traneptora.lightlevel.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public final class FileCollector {

    private FileCollector() {

    }

    public static boolean isTiff(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".tif") || name.endsWith(".tiff");
    }

    /**
     * @return every TIFF file under {@code directory}, recursively, sorted by
     *         path ignoring case
     */
    public static List<Path> findTiffFiles(Path directory) throws IOException {
        try (Stream<Path> walk = Files.walk(directory)) {
            return walk.filter(Files::isRegularFile)
                .filter(FileCollector::isTiff)
                .sorted(Comparator.comparing(Path::toString, String.CASE_INSENSITIVE_ORDER))
                .collect(Collectors.toList());
        }
    }

    /**
     * Expands a leading {@code ~/} to the home directory and makes the path absolute.
     */
    public static Path resolveUserPath(String path) {
        if (path.startsWith("~/"))
            path = System.getProperty("user.home") + path.substring(1);
        return Path.of(path).toAbsolutePath().normalize();
    }
}
