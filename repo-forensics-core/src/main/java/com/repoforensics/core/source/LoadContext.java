package com.repoforensics.core.source;

import com.repoforensics.core.util.FileUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Context provided to source loaders during execution.
 *
 * @param resultsDirectory directory holding the analysis inputs
 * @param repositoryName repository name substituted for {@code {repo}} in file names
 * @param repositoryRoot checkout root stripped from absolute paths, may be null
 * @param fileNames file name overrides keyed by loader ID
 * @param settings additional loader settings
 */
public record LoadContext(
    Path resultsDirectory,
    String repositoryName,
    String repositoryRoot,
    Map<String, String> fileNames,
    Map<String, String> settings
) {
    /** Placeholder for the repository name in file name patterns. */
    public static final String REPO_PLACEHOLDER = "{repo}";

    /**
     * Compact constructor with validation.
     */
    public LoadContext {
        Objects.requireNonNull(resultsDirectory, "resultsDirectory must not be null");
        Objects.requireNonNull(repositoryName, "repositoryName must not be null");
        if (fileNames == null) {
            fileNames = Map.of();
        }
        if (settings == null) {
            settings = Map.of();
        }
    }

    /**
     * Returns the file name pattern for a loader: the configured override or the default.
     *
     * @param loaderId loader ID
     * @param defaultFileName default file name pattern
     * @return file name pattern, possibly containing {@code {repo}}
     */
    public String fileNameFor(String loaderId, String defaultFileName) {
        return fileNames.getOrDefault(loaderId, defaultFileName);
    }

    /**
     * Returns the expected location of a source, whether or not it exists.
     *
     * @param fileNamePattern file name pattern
     * @return path inside the results directory
     */
    public Path expectedPath(String fileNamePattern) {
        return resultsDirectory.resolve(fileNamePattern.replace(REPO_PLACEHOLDER, repositoryName));
    }

    /**
     * Locates a source file.
     *
     * <p>Tries the exact file name first. If it is absent and the pattern contains
     * {@code {repo}}, falls back to the first file (in sorted order) matching the pattern with
     * {@code {repo}} replaced by {@code *}.
     *
     * @param fileNamePattern file name pattern
     * @return the source file, or empty if none exists
     * @throws IOException if the results directory cannot be listed
     */
    public Optional<Path> resolveSource(String fileNamePattern) throws IOException {
        Path exact = expectedPath(fileNamePattern);
        if (Files.isRegularFile(exact)) {
            return Optional.of(exact);
        }
        if (!fileNamePattern.contains(REPO_PLACEHOLDER) || !Files.isDirectory(resultsDirectory)) {
            return Optional.empty();
        }
        List<Path> candidates = FileUtils.findFiles(resultsDirectory, fileNamePattern.replace(REPO_PLACEHOLDER, "*"));
        return candidates.stream().findFirst();
    }

    /**
     * Gets a setting with a default.
     *
     * @param key setting key
     * @param defaultValue default value
     * @return setting value or default
     */
    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }
}
