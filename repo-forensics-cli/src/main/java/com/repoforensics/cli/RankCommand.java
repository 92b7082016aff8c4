package com.repoforensics.cli;

import com.repoforensics.core.config.ConfigurationException;
import com.repoforensics.core.config.ProjectConfig;
import com.repoforensics.core.engine.AnalysisRequest;
import com.repoforensics.core.engine.AnalysisResult;
import com.repoforensics.core.engine.WeightedRanker;
import com.repoforensics.core.model.Signal;
import com.repoforensics.core.model.WeightVector;
import com.repoforensics.core.renderer.GeneratedFile;
import com.repoforensics.core.renderer.GeneratedOutput;
import com.repoforensics.core.renderer.RenderContext;
import com.repoforensics.core.renderer.impl.ConsoleRenderer;
import com.repoforensics.core.report.ReportConfig;
import com.repoforensics.core.report.ReportEmitter;
import com.repoforensics.core.report.ReportFormat;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Command that ranks the developers of a repository and writes the reports.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Load {@code repoforensics.yaml} and apply {@code --weight-*} overrides</li>
 *   <li>Validate the weight vector (exit 2 when invalid)</li>
 *   <li>Load every input source, compute hotspots and developer signals</li>
 *   <li>Print the summary and write the configured report formats</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Rank with default weights, reports next to the inputs
 * repo-forensics rank ./results/my-repo
 *
 * # Print only, write nothing
 * repo-forensics rank ./results/my-repo --dry-run --detailed 3
 *
 * # Explicit output files
 * repo-forensics rank ./results/my-repo --output-json ranking.json --output-csv ranking.csv
 * }</pre>
 */
@Command(
    name = "rank",
    description = "Rank developers by weighted contribution signals",
    mixinStandardHelpOptions = true
)
public class RankCommand extends AbstractAnalysisCommand {

    @Option(names = {"--detailed"}, description = "Developers shown with a full breakdown (default: 0)")
    private Integer detailed;

    @Option(names = {"--output-json"}, description = "Ranking JSON file (overrides the default name)")
    private Path outputJson;

    @Option(names = {"--output-csv"}, description = "Ranking CSV file (overrides the default name)")
    private Path outputCsv;

    @Option(names = {"--dry-run"}, description = "Compute and print the ranking without writing files")
    private boolean dryRun;

    @Option(names = {"--weight-commits"}, description = "Weight of the commit count signal")
    private Double weightCommits;

    @Option(names = {"--weight-churn"}, description = "Weight of the code churn signal")
    private Double weightChurn;

    @Option(names = {"--weight-hotspots"}, description = "Weight of the hotspot work signal")
    private Double weightHotspots;

    @Option(names = {"--weight-ownership"}, description = "Weight of the ownership signal")
    private Double weightOwnership;

    @Option(names = {"--weight-complexity"}, description = "Weight of the complexity signal")
    private Double weightComplexity;

    @Option(names = {"--weight-communication"}, description = "Weight of the communication signal")
    private Double weightCommunication;

    @Option(names = {"--weight-recency"}, description = "Weight of the recency signal")
    private Double weightRecency;

    @Option(names = {"--weight-fragmentation"}, description = "Weight of the fragmentation signal")
    private Double weightFragmentation;

    @Option(names = {"--weight-coupling"}, description = "Weight of the coupling signal")
    private Double weightCoupling;

    @Option(names = {"--weight-hotspot-commits"}, description = "Weight of the hotspot commit signal")
    private Double weightHotspotCommits;

    @Override
    protected int execute(ProjectConfig config, AnalysisRequest request) {
        WeightVector weights = applyOverrides(request.weights());
        WeightedRanker.validate(weights);
        log.debug("Using weights: {}", weights.toKeyedMap());

        System.out.println("Analyzing results in: " + resultsDir.toAbsolutePath());
        AnalysisResult result = createEngine().analyze(request.withWeights(weights));

        ReportConfig reportConfig = new ReportConfig(
            top(config),
            detailed != null ? detailed : config.detailed(),
            config.topFiles(),
            Map.of()
        );
        ReportEmitter emitter = new ReportEmitter();

        GeneratedOutput summary = emitter.emit(result, List.of(ReportFormat.SUMMARY_TEXT), reportConfig);
        new ConsoleRenderer().render(summary, RenderContext.of(resultsDir));
        printQualityGaps(result);

        if (dryRun) {
            System.out.println();
            System.out.println("Dry-run mode: no reports written");
            return EXIT_OK;
        }

        Set<ReportFormat> formats = formats(config);
        GeneratedOutput output = emitter.emit(result, formats, reportConfig);
        List<GeneratedFile> regular = new ArrayList<>();
        for (GeneratedFile file : output.files()) {
            Path explicit = explicitTarget(file, reportConfig, result.repository());
            if (explicit != null) {
                writeTo(explicit, file);
            } else {
                regular.add(file);
            }
        }
        if (!regular.isEmpty()) {
            write(new GeneratedOutput(regular), outputDirectory(config));
        }

        System.out.println();
        System.out.println("✓ Ranked " + result.ranking().totalDevelopers() + " developers");
        return EXIT_OK;
    }

    private WeightVector applyOverrides(WeightVector weights) {
        Map<Signal, Double> overrides = new EnumMap<>(Signal.class);
        putIfSet(overrides, Signal.COMMITS, weightCommits);
        putIfSet(overrides, Signal.CHURN, weightChurn);
        putIfSet(overrides, Signal.HOTSPOT_WORK, weightHotspots);
        putIfSet(overrides, Signal.OWNERSHIP, weightOwnership);
        putIfSet(overrides, Signal.COMPLEXITY, weightComplexity);
        putIfSet(overrides, Signal.COMMUNICATION, weightCommunication);
        putIfSet(overrides, Signal.RECENCY, weightRecency);
        putIfSet(overrides, Signal.FRAGMENTATION, weightFragmentation);
        putIfSet(overrides, Signal.COUPLING, weightCoupling);
        putIfSet(overrides, Signal.HOTSPOT_COMMITS, weightHotspotCommits);

        WeightVector result = weights;
        for (Map.Entry<Signal, Double> entry : overrides.entrySet()) {
            result = result.with(entry.getKey(), entry.getValue());
        }
        return result;
    }

    private static void putIfSet(Map<Signal, Double> overrides, Signal signal, Double value) {
        if (value != null) {
            overrides.put(signal, value);
        }
    }

    private Set<ReportFormat> formats(ProjectConfig config) {
        Set<ReportFormat> formats = EnumSet.noneOf(ReportFormat.class);
        if (config.output() == null || config.output().formats() == null || config.output().formats().isEmpty()) {
            formats.addAll(EnumSet.allOf(ReportFormat.class));
        } else {
            for (String name : config.output().formats()) {
                formats.add(ReportFormat.fromName(name)
                    .orElseThrow(() -> new ConfigurationException("Unknown output format '" + name + "'")));
            }
        }
        if (outputJson != null) {
            formats.add(ReportFormat.RANKING_JSON);
        }
        if (outputCsv != null) {
            formats.add(ReportFormat.RANKING_CSV);
        }
        return formats;
    }

    private Path explicitTarget(GeneratedFile file, ReportConfig reportConfig, String repository) {
        if (outputJson != null && file.fileName().equals(reportConfig.fileName(ReportFormat.RANKING_JSON, repository))) {
            return outputJson;
        }
        if (outputCsv != null && file.fileName().equals(reportConfig.fileName(ReportFormat.RANKING_CSV, repository))) {
            return outputCsv;
        }
        return null;
    }

    private void writeTo(Path target, GeneratedFile file) {
        Path absolute = target.toAbsolutePath().normalize();
        GeneratedFile renamed = new GeneratedFile(absolute.getFileName().toString(), file.content(), file.contentType());
        write(new GeneratedOutput(List.of(renamed)), absolute.getParent());
    }
}
