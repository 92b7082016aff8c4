package com.repoforensics.cli;

import com.repoforensics.core.config.ConfigLoader;
import com.repoforensics.core.config.ConfigurationException;
import com.repoforensics.core.config.ProjectConfig;
import com.repoforensics.core.engine.WeightedRanker;
import com.repoforensics.core.model.Signal;
import com.repoforensics.core.model.WeightVector;
import com.repoforensics.core.report.ReportFormat;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to validate a configuration file: YAML syntax, weight names, the weight vector
 * and the output formats. Exits 0 when valid, 2 otherwise.
 */
@Command(
    name = "validate",
    description = "Validate a configuration file and its weight vector",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Config file to validate", defaultValue = ConfigLoader.DEFAULT_FILE_NAME)
    private Path configFile;

    @Override
    public Integer call() {
        log.info("Validating configuration: {}", configFile);
        try {
            ProjectConfig config = ConfigLoader.loadStrict(configFile);
            WeightVector weights = config.weightVector();
            WeightedRanker.validate(weights);
            if (config.output() != null && config.output().formats() != null) {
                for (String name : config.output().formats()) {
                    ReportFormat.fromName(name)
                        .orElseThrow(() -> new ConfigurationException("Unknown output format '" + name + "'"));
                }
            }

            System.out.println("✓ Configuration is valid: " + configFile);
            for (Signal signal : Signal.values()) {
                System.out.printf(Locale.ROOT, "  %-16s %.2f%n", signal.displayName(), weights.weight(signal));
            }
            return AbstractAnalysisCommand.EXIT_OK;
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.err.println("✗ " + e.getMessage());
            return AbstractAnalysisCommand.EXIT_CONFIG_ERROR;
        }
    }
}
