package com.repoforensics.core.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Discovers {@link SourceLoader} implementations via {@link ServiceLoader}.
 */
public final class SourceLoaders {

    private static final Logger log = LoggerFactory.getLogger(SourceLoaders.class);

    private SourceLoaders() {
        // Utility class
    }

    /**
     * Discovers all registered loaders, sorted by ascending priority.
     *
     * @return loaders in execution order
     */
    public static List<SourceLoader> discover() {
        List<SourceLoader> loaders = new ArrayList<>();
        ServiceLoader.load(SourceLoader.class).forEach(loaders::add);
        loaders.sort(Comparator.comparingInt(SourceLoader::getPriority));

        log.debug("Discovered {} source loaders", loaders.size());
        if (log.isDebugEnabled()) {
            loaders.forEach(l -> log.debug("  - {} ({})", l.getId(), l.getDisplayName()));
        }
        return loaders;
    }
}
