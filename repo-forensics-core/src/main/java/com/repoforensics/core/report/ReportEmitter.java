package com.repoforensics.core.report;

import com.repoforensics.core.engine.AnalysisResult;
import com.repoforensics.core.renderer.GeneratedFile;
import com.repoforensics.core.renderer.GeneratedOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Produces report files for an analysis result using the registered {@link ReportGenerator}s.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ReportEmitter emitter = new ReportEmitter();
 * GeneratedOutput output = emitter.emit(result, List.of(ReportFormat.RANKING_JSON), ReportConfig.defaults());
 * new FileSystemRenderer().render(output, RenderContext.of(Path.of("./reports")));
 * }</pre>
 */
public class ReportEmitter {

    private static final Logger log = LoggerFactory.getLogger(ReportEmitter.class);

    private final List<ReportGenerator> generators;

    /**
     * Creates an emitter with every generator registered via ServiceLoader.
     */
    public ReportEmitter() {
        this(discoverGenerators());
    }

    /**
     * Creates an emitter with explicit generators.
     *
     * @param generators report generators
     */
    public ReportEmitter(List<ReportGenerator> generators) {
        this.generators = List.copyOf(generators);
    }

    /**
     * Generates the requested reports.
     *
     * @param result analysis result
     * @param formats formats to produce, in output order
     * @param config report settings
     * @return generated files ready for rendering
     * @throws IllegalArgumentException if no generator supports a requested format
     */
    public GeneratedOutput emit(AnalysisResult result, Collection<ReportFormat> formats, ReportConfig config) {
        List<GeneratedFile> files = new ArrayList<>();
        for (ReportFormat format : formats) {
            ReportGenerator generator = generatorFor(format);
            log.debug("Generating {} with {}", format, generator.getId());
            GeneratedReport report = generator.generate(result, format, config);
            files.add(new GeneratedFile(report.fileName(), report.content(), format.contentType()));
        }
        log.info("Generated {} reports for {}", files.size(), result.repository());
        return new GeneratedOutput(files);
    }

    /**
     * Returns the generators known to this emitter.
     *
     * @return generators
     */
    public List<ReportGenerator> generators() {
        return generators;
    }

    private ReportGenerator generatorFor(ReportFormat format) {
        return generators.stream()
            .filter(generator -> generator.getSupportedFormats().contains(format))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("No report generator supports " + format));
    }

    /**
     * Discovers all report generators via SPI.
     *
     * @return registered generators
     */
    public static List<ReportGenerator> discoverGenerators() {
        List<ReportGenerator> discovered = new ArrayList<>();
        ServiceLoader.load(ReportGenerator.class).forEach(discovered::add);
        log.debug("Discovered {} report generators", discovered.size());
        return discovered;
    }
}
