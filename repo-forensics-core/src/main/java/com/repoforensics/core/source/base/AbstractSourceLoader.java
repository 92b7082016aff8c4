package com.repoforensics.core.source.base;

import com.repoforensics.core.source.LoadContext;
import com.repoforensics.core.source.LoadResult;
import com.repoforensics.core.source.SourceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Abstract base class for source loader implementations providing common functionality.
 *
 * <p>This class reduces code duplication across loaders by providing:
 * <ul>
 *   <li>Logger initialization (one logger per loader class)</li>
 *   <li>Source file resolution including the {@code {repo}} glob fallback</li>
 *   <li>Missing-file and I/O-failure handling ({@link LoadResult#missing}, {@link LoadResult#failed})</li>
 *   <li>Per-row skip accounting through {@link RecordCollector}</li>
 * </ul>
 *
 * <p>Concrete loaders only implement {@link #decode(Path, LoadContext, RecordCollector)}.
 *
 * @see SourceLoader
 * @see AbstractCsvSourceLoader
 * @see AbstractJsonSourceLoader
 */
public abstract class AbstractSourceLoader implements SourceLoader {

    /**
     * Logger instance for this loader.
     * Automatically initialized with the concrete loader class name.
     */
    protected final Logger log;

    /**
     * Constructor that initializes the logger for the concrete loader class.
     */
    protected AbstractSourceLoader() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public LoadResult load(LoadContext context) {
        String pattern = context.fileNameFor(getId(), getDefaultFileName());
        Path expected = context.expectedPath(pattern);

        Optional<Path> source;
        try {
            source = context.resolveSource(pattern);
        } catch (IOException e) {
            log.error("Failed to look up {} in {}: {}", getDisplayName(), context.resultsDirectory(), e.getMessage());
            return LoadResult.failed(getId(), expected, e.getMessage());
        }

        if (source.isEmpty()) {
            log.warn("{} not found: {}", getDisplayName(), expected);
            return LoadResult.missing(getId(), expected);
        }

        Path file = source.get();
        RecordCollector collector = new RecordCollector(getId(), log);
        try {
            log.debug("Loading {} from {}", getDisplayName(), file);
            decode(file, context, collector);
        } catch (IOException e) {
            log.error("Failed to read {} from {}: {}", getDisplayName(), file, e.getMessage());
            return LoadResult.failed(getId(), file, e.getMessage());
        }

        LoadResult result = collector.toResult(file);
        log.info("Loaded {} {} records from {}", collector.size(), getId(), file.getFileName());
        if (result.statistics().hasSkips()) {
            log.warn("{}: {}", getDisplayName(), result.statistics().getSummary());
        }
        return result;
    }

    /**
     * Decodes the source file, adding every record (or skip) to the collector.
     *
     * @param file source file
     * @param context load context
     * @param collector receives decoded records and skipped rows
     * @throws IOException if the file cannot be read or parsed as a whole
     */
    protected abstract void decode(Path file, LoadContext context, RecordCollector collector) throws IOException;
}
