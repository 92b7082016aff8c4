package com.repoforensics.cli;

import com.repoforensics.core.config.ConfigLoader;
import com.repoforensics.core.config.ConfigurationException;
import com.repoforensics.core.config.ProjectConfig;
import com.repoforensics.core.engine.AnalysisEngine;
import com.repoforensics.core.engine.AnalysisRequest;
import com.repoforensics.core.engine.AnalysisResult;
import com.repoforensics.core.model.GapSeverity;
import com.repoforensics.core.model.QualityGap;
import com.repoforensics.core.renderer.GeneratedOutput;
import com.repoforensics.core.renderer.RenderContext;
import com.repoforensics.core.renderer.impl.FileSystemRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Shared behaviour of the commands that run an analysis over a results directory.
 *
 * <p>Subclasses build the reports in {@link #execute(ProjectConfig, AnalysisRequest)}; this
 * class resolves the configuration and maps failures to exit codes: 0 on success, 1 when the
 * results directory is missing or the run fails, 2 on a configuration error.
 */
public abstract class AbstractAnalysisCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    protected final Logger log = LoggerFactory.getLogger(getClass());

    @Parameters(index = "0", description = "Results directory holding the mining outputs")
    protected Path resultsDir;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: <resultsDir>/" + ConfigLoader.DEFAULT_FILE_NAME + ")"
    )
    protected Path configPath;

    @Option(names = {"-o", "--output"}, description = "Output directory (overrides config)")
    protected Path outputDir;

    @Option(names = {"--top"}, description = "Rows shown in the console summary (default: 20)")
    protected Integer top;

    @Override
    public Integer call() {
        if (!Files.isDirectory(resultsDir)) {
            log.error("Results directory not found: {}", resultsDir);
            System.err.println("✗ Results directory not found: " + resultsDir.toAbsolutePath());
            return EXIT_FAILURE;
        }

        try {
            ProjectConfig config = loadConfiguration();
            AnalysisRequest request = AnalysisRequest.from(resultsDir, config);
            return execute(config, request);
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.err.println("✗ Invalid configuration: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        } catch (Exception e) {
            log.error("Analysis failed", e);
            System.err.println("✗ Analysis failed: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /**
     * Runs the command once the configuration is loaded.
     *
     * @param config project configuration
     * @param request analysis request built from the configuration
     * @return exit code
     */
    protected abstract int execute(ProjectConfig config, AnalysisRequest request);

    protected AnalysisEngine createEngine() {
        return new AnalysisEngine();
    }

    /**
     * Loads the project configuration. A file named with {@code --config} must exist and parse;
     * the default file in the results directory is optional and falls back to defaults.
     *
     * @return project configuration
     * @throws ConfigurationException if an explicit configuration file is missing or malformed
     */
    protected ProjectConfig loadConfiguration() {
        if (configPath != null) {
            log.debug("Loading configuration from: {}", configPath);
            return ConfigLoader.loadStrict(configPath);
        }
        Path path = resultsDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        log.debug("Loading configuration from: {}", path);
        return ConfigLoader.load(path);
    }

    protected int top(ProjectConfig config) {
        return top != null ? top : config.top();
    }

    protected Path outputDirectory(ProjectConfig config) {
        if (outputDir != null) {
            return outputDir;
        }
        if (config.output() != null && config.output().directory() != null) {
            return Paths.get(config.output().directory());
        }
        return resultsDir;
    }

    protected void write(GeneratedOutput output, Path directory) {
        new FileSystemRenderer().render(output, RenderContext.of(directory));
        output.files().forEach(file -> System.out.println("✓ Wrote " + directory.resolve(file.fileName())));
    }

    protected void printQualityGaps(AnalysisResult result) {
        long problems = result.qualityGaps().stream()
            .filter(gap -> gap.severity() != GapSeverity.INFO)
            .count();
        if (problems == 0) {
            return;
        }
        System.out.println();
        System.out.println("Data quality (" + problems + " issues):");
        for (QualityGap gap : result.qualityGaps()) {
            if (gap.severity() != GapSeverity.INFO) {
                System.out.printf("  [%s] %s: %s%n", gap.severity(), gap.sourceId(), gap.message());
            }
        }
    }
}
