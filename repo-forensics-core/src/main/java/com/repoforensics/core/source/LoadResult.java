package com.repoforensics.core.source;

import com.repoforensics.core.model.SourceRecord;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Result returned by a source loader after execution.
 *
 * @param loaderId ID of the loader that produced this result
 * @param status load outcome
 * @param sourceFile file that was read, or the expected location when missing
 * @param records decoded records in file order
 * @param warnings non-fatal issues, one per skipped row
 * @param error reason for a failed load, null otherwise
 * @param statistics row statistics
 */
public record LoadResult(
    String loaderId,
    LoadStatus status,
    Path sourceFile,
    List<SourceRecord> records,
    List<String> warnings,
    String error,
    LoadStatistics statistics
) {
    /**
     * Compact constructor with validation.
     */
    public LoadResult {
        Objects.requireNonNull(loaderId, "loaderId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        records = records == null ? List.of() : List.copyOf(records);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (statistics == null) {
            statistics = LoadStatistics.empty();
        }
    }

    /**
     * Creates a successful result.
     *
     * @param loaderId loader ID
     * @param sourceFile file that was read
     * @param records decoded records
     * @param warnings skipped-row messages
     * @param statistics row statistics
     * @return loaded result
     */
    public static LoadResult loaded(String loaderId, Path sourceFile, List<SourceRecord> records,
                                    List<String> warnings, LoadStatistics statistics) {
        return new LoadResult(loaderId, LoadStatus.LOADED, sourceFile, records, warnings, null, statistics);
    }

    /**
     * Creates a result for a source file that does not exist.
     *
     * @param loaderId loader ID
     * @param expectedFile where the file was looked for
     * @return missing result
     */
    public static LoadResult missing(String loaderId, Path expectedFile) {
        return new LoadResult(loaderId, LoadStatus.MISSING, expectedFile, List.of(), List.of(), null, LoadStatistics.empty());
    }

    /**
     * Creates a result for a source file that could not be read.
     *
     * @param loaderId loader ID
     * @param sourceFile file that failed
     * @param error failure reason
     * @return failed result
     */
    public static LoadResult failed(String loaderId, Path sourceFile, String error) {
        return new LoadResult(loaderId, LoadStatus.FAILED, sourceFile, List.of(), List.of(), error, LoadStatistics.empty());
    }

    /**
     * Returns the records of one type.
     *
     * @param type record type
     * @param <T> record type
     * @return records of that type in file order
     */
    public <T extends SourceRecord> List<T> recordsOf(Class<T> type) {
        return records.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .toList();
    }

    /**
     * Returns true if the source was read.
     *
     * @return true if status is {@link LoadStatus#LOADED}
     */
    public boolean isLoaded() {
        return status == LoadStatus.LOADED;
    }
}
