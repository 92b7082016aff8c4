package com.repoforensics.core.source;

import com.repoforensics.core.model.Signal;

import java.nio.file.Path;
import java.util.Set;

/**
 * Interface for loaders that decode one analysis input file into typed records.
 *
 * <p>Each loader reads one data source produced by an external tool (commit history, revision
 * counts, complexity, ownership, ...) and turns every row into a
 * {@link com.repoforensics.core.model.SourceRecord}. Loaders are discovered via Java Service
 * Provider Interface (SPI) and executed in priority order (lower numbers first).
 *
 * <p>A loader never fails the analysis run. A missing file yields
 * {@link LoadResult#missing(String, Path)}, an unreadable file yields
 * {@link LoadResult#failed(String, Path, String)}, and a malformed row is skipped and counted
 * in {@link LoadStatistics}.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.repoforensics.core.source.SourceLoader}
 *
 * @see LoadContext
 * @see LoadResult
 */
public interface SourceLoader {

    /**
     * Returns unique identifier for this loader.
     *
     * <p>Used as the configuration key for file name overrides ({@code sources.<id>}) and in
     * quality gaps. Should be kebab-case (e.g., "entity-ownership").
     *
     * @return unique loader identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this loader.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the default file name of the source, relative to the results directory.
     *
     * <p>The placeholder {@code {repo}} is replaced with the repository name.
     *
     * @return default file name pattern
     */
    String getDefaultFileName();

    /**
     * Returns the signals that stay at zero when this source is missing.
     *
     * @return affected signals
     */
    Set<Signal> getAffectedSignals();

    /**
     * Returns execution priority for this loader.
     *
     * <p>Lower values execute first. File-level sources (revisions, complexity, coupling,
     * fragmentation) run before developer-level sources.
     *
     * @return priority value (lower = earlier execution)
     */
    int getPriority();

    /**
     * Loads and decodes the source.
     *
     * @param context load context with the results directory and file name overrides
     * @return load result holding decoded records and statistics
     */
    LoadResult load(LoadContext context);
}
