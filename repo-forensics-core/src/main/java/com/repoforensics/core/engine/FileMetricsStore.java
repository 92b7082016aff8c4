package com.repoforensics.core.engine;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-file metrics table for one analysis run.
 *
 * <p>Revision rows define the file set: each distinct canonical path gets its own entry, so
 * {@code README.md} and {@code docs/README.md} stay separate files. Complexity, coupling and
 * fragmentation rows go through the {@link PathReconciler} (exact key, then segment suffix)
 * and only update files that already have an entry; a row that matches nothing is dropped.
 * The {@code record...} methods report whether the path matched a known file, so callers can
 * count unmatched paths per source.
 *
 * <p>Not thread-safe; a run is single-threaded.
 */
public class FileMetricsStore {

    private final PathReconciler reconciler = new PathReconciler();
    private final Map<String, FileMetrics> files = new LinkedHashMap<>();

    /**
     * Adds revisions to a file.
     *
     * @param path file path
     * @param count revision count
     * @return true if the exact path was already known
     */
    public boolean recordRevisions(String path, int count) {
        Optional<FileMetrics> existing = reconciler.resolveExact(path).map(files::get);
        FileMetrics metrics = existing.orElseGet(() -> create(path));
        metrics.addRevisions(count);
        return existing.isPresent();
    }

    /**
     * Adds one function measurement to a file's complexity aggregate.
     *
     * @param path file path
     * @param cyclomaticComplexity cyclomatic complexity of the function
     * @param linesOfCode lines of code of the function
     * @return true if the path matched a known file; false means the row was dropped
     */
    public boolean recordComplexity(String path, int cyclomaticComplexity, int linesOfCode) {
        Optional<FileMetrics> existing = find(path);
        existing.ifPresent(metrics -> metrics.addFunction(cyclomaticComplexity, linesOfCode));
        return existing.isPresent();
    }

    /**
     * Adds a sum-of-coupling value to a file.
     *
     * @param path file path
     * @param sumOfCoupling sum of coupling
     * @return true if the path matched a known file
     */
    public boolean recordCoupling(String path, int sumOfCoupling) {
        Optional<FileMetrics> existing = find(path);
        existing.ifPresent(metrics -> metrics.addCoupling(sumOfCoupling));
        return existing.isPresent();
    }

    /**
     * Adds a fragmentation value to a file.
     *
     * @param path file path
     * @param fractalValue fractal value
     * @return true if the path matched a known file
     */
    public boolean recordFragmentation(String path, double fractalValue) {
        Optional<FileMetrics> existing = find(path);
        existing.ifPresent(metrics -> metrics.addFragmentation(fractalValue));
        return existing.isPresent();
    }

    /**
     * Looks up the file a path refers to.
     *
     * @param path file path in any source's representation
     * @return the file's metrics, or empty if the path matches no known file
     */
    public Optional<FileMetrics> find(String path) {
        return reconciler.resolve(path).map(files::get);
    }

    /**
     * Returns every known file in first-seen order.
     *
     * @return unmodifiable view of the files
     */
    public Collection<FileMetrics> files() {
        return Collections.unmodifiableCollection(files.values());
    }

    /**
     * Returns the number of known files.
     *
     * @return file count
     */
    public int size() {
        return files.size();
    }

    private FileMetrics create(String path) {
        String key = reconciler.register(path);
        FileMetrics metrics = new FileMetrics(key, path);
        files.put(key, metrics);
        return metrics;
    }
}
