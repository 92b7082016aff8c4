package com.repoforensics.cli;

import com.repoforensics.core.model.Signal;
import com.repoforensics.core.renderer.OutputRenderer;
import com.repoforensics.core.report.ReportEmitter;
import com.repoforensics.core.report.ReportGenerator;
import com.repoforensics.core.source.SourceLoader;
import com.repoforensics.core.source.SourceLoaders;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command to list available input sources, report generators, or renderers.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * repo-forensics list sources
 * repo-forensics list generators
 * repo-forensics list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available sources, generators, or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: sources, generators, or renderers"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase()) {
            case "sources", "source" -> listSources();
            case "generators", "generator" -> listGenerators();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: sources, generators, or renderers", type);
                yield 1;
            }
        };
    }

    private int listSources() {
        System.out.println("Available Sources:");
        System.out.println();

        for (SourceLoader loader : SourceLoaders.discover()) {
            System.out.printf("  • %s (ID: %s)%n", loader.getDisplayName(), loader.getId());
            System.out.printf("    Default file: %s%n", loader.getDefaultFileName());
            System.out.printf("    Signals: %s%n", loader.getAffectedSignals().stream()
                .map(Signal::key)
                .sorted()
                .collect(Collectors.joining(", ")));
            System.out.println();
        }
        return 0;
    }

    private int listGenerators() {
        System.out.println("Available Generators:");
        System.out.println();

        for (ReportGenerator generator : ReportEmitter.discoverGenerators()) {
            System.out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            System.out.printf("    Formats: %s%n", generator.getSupportedFormats().stream()
                .map(Enum::name)
                .sorted()
                .collect(Collectors.joining(", ")));
            System.out.println();
        }
        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        List<OutputRenderer> renderers = OutputRenderer.discover();
        for (OutputRenderer renderer : renderers) {
            System.out.printf("  • %s (ID: %s)%n", renderer.getDisplayName(), renderer.getId());
        }
        return 0;
    }
}
