package com.repoforensics.core.util;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for file and path operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds files directly inside a directory whose name matches a glob pattern.
     *
     * @param directory directory to list
     * @param globPattern glob pattern matched against the file name
     * @return matching files sorted by name
     * @throws IOException if the directory cannot be listed
     */
    public static List<Path> findFiles(Path directory, String globPattern) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);

        try (Stream<Path> paths = Files.list(directory)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> matcher.matches(path.getFileName()))
                .sorted()
                .toList();
        }
    }

    /**
     * Replaces backslashes with forward slashes.
     *
     * @param path path string
     * @return path with forward slashes only
     */
    public static String toForwardSlashes(String path) {
        return path.replace('\\', '/');
    }

    /**
     * Removes a directory prefix from a path string.
     *
     * <p>The prefix is compared with forward slashes and matches only on a directory boundary.
     *
     * @param path path string
     * @param prefix directory prefix, may be null or blank
     * @return the path relative to the prefix, or the unchanged path if it does not start with it
     */
    public static String stripPrefix(String path, String prefix) {
        if (prefix == null || prefix.isBlank()) {
            return path;
        }
        String normalizedPrefix = toForwardSlashes(prefix.trim());
        if (!normalizedPrefix.endsWith("/")) {
            normalizedPrefix = normalizedPrefix + "/";
        }
        return path.startsWith(normalizedPrefix) ? path.substring(normalizedPrefix.length()) : path;
    }

    /**
     * Truncates text to a maximum length.
     *
     * @param text text to truncate
     * @param maxLength maximum length
     * @return the text, cut to {@code maxLength} characters if longer
     */
    public static String truncate(String text, int maxLength) {
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }
}
