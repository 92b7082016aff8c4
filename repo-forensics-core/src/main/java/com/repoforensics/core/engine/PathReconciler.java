package com.repoforensics.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Matches file paths reported by different tools so that records about the same file join.
 *
 * <p>Paths are reduced to a canonical key: backslashes become forward slashes and the whole
 * string is lower-cased. A lookup first tries the exact key, then scans the known keys in
 * registration order for one that is a suffix of the looked-up key or has it as a suffix.
 * A suffix only counts when it starts at a path segment, so {@code util.py} matches
 * {@code src/util.py} but not {@code src/myutil.py}. The first suffix match wins; candidates
 * are not scored against each other.
 *
 * <p>The suffix scan is linear in the number of known files per miss. Progress is logged at
 * DEBUG every {@value #PROGRESS_INTERVAL} candidates.
 */
public class PathReconciler {

    static final int PROGRESS_INTERVAL = 1000;

    private static final Logger log = LoggerFactory.getLogger(PathReconciler.class);

    private final Map<String, String> knownPaths = new LinkedHashMap<>();

    /**
     * Returns the canonical key of a path. Applying it to a canonical key returns the same key.
     *
     * @param path path as reported by a tool
     * @return canonical key
     */
    public static String canonicalize(String path) {
        return path.trim().replace('\\', '/').toLowerCase();
    }

    /**
     * Registers a path as a known file.
     *
     * @param path path as reported by a tool
     * @return canonical key of the registered path
     */
    public String register(String path) {
        String key = canonicalize(path);
        knownPaths.putIfAbsent(key, path);
        return key;
    }

    /**
     * Finds the known file a path refers to.
     *
     * @param path path as reported by a tool
     * @return canonical key of the matching known file, or empty if unmatched
     */
    public Optional<String> resolve(String path) {
        String key = canonicalize(path);
        if (knownPaths.containsKey(key)) {
            return Optional.of(key);
        }
        if (key.isEmpty()) {
            return Optional.empty();
        }

        int scanned = 0;
        for (String candidate : knownPaths.keySet()) {
            scanned++;
            if (scanned % PROGRESS_INTERVAL == 0) {
                log.debug("Suffix matching '{}': scanned {} of {} known files", path, scanned, knownPaths.size());
            }
            if (isSegmentSuffix(candidate, key) || isSegmentSuffix(key, candidate)) {
                log.debug("Matched '{}' to '{}' by suffix", path, knownPaths.get(candidate));
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the canonical key of a path if that exact key is known, without suffix matching.
     *
     * @param path path as reported by a tool
     * @return canonical key, or empty if no file has exactly that key
     */
    public Optional<String> resolveExact(String path) {
        String key = canonicalize(path);
        return knownPaths.containsKey(key) ? Optional.of(key) : Optional.empty();
    }

    static boolean isSegmentSuffix(String path, String suffix) {
        if (suffix.isEmpty() || suffix.length() >= path.length() || !path.endsWith(suffix)) {
            return false;
        }
        return suffix.charAt(0) == '/' || path.charAt(path.length() - suffix.length() - 1) == '/';
    }

    /**
     * Returns the path as first registered for a canonical key.
     *
     * @param key canonical key
     * @return original path, or null if the key is unknown
     */
    public String displayPath(String key) {
        return knownPaths.get(key);
    }

    /**
     * Returns the number of known files.
     *
     * @return known file count
     */
    public int size() {
        return knownPaths.size();
    }
}
