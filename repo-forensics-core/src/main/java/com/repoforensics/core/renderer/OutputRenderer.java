package com.repoforensics.core.renderer;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Sends generated reports to a destination.
 *
 * <p>Renderers are discovered via {@link ServiceLoader}. Register implementations in
 * {@code META-INF/services/com.repoforensics.core.renderer.OutputRenderer}.
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer (e.g. "filesystem", "console").
     *
     * @return renderer identifier
     */
    String getId();

    /**
     * Returns human-readable name for CLI listings.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Renders the reports.
     *
     * @param output reports to render
     * @param context output directory and renderer settings
     * @throws IllegalStateException if a report cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);

    /**
     * Discovers all registered renderers.
     *
     * @return renderers in service-file order
     */
    static List<OutputRenderer> discover() {
        List<OutputRenderer> renderers = new ArrayList<>();
        ServiceLoader.load(OutputRenderer.class).forEach(renderers::add);
        return renderers;
    }
}
