package com.repoforensics.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.repoforensics.core.model.Signal;
import com.repoforensics.core.model.WeightVector;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Root configuration for a Repo Forensics analysis.
 *
 * <p>Loaded from {@code repoforensics.yaml}. Every section is optional; absent values fall
 * back to the defaults exposed by the helper methods on this record.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: my-repo
 *   repositoryRoot: /work/repositories/my-repo
 *
 * sources:
 *   soc: "{repo}_code-analysis_soc.csv"
 *
 * ranking:
 *   top: 20
 *   detailed: 3
 *   weights:
 *     commits: 0.20
 *     hotspot_work: 0.15
 *
 * output:
 *   directory: ./reports
 *   formats: [RANKING_JSON, SUMMARY_TEXT]
 * }</pre>
 *
 * @param project project metadata
 * @param sources file name overrides keyed by source loader ID
 * @param ranking ranking settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("sources") Map<String, String> sources,
    @JsonProperty("ranking") RankingConfig ranking,
    @JsonProperty("output") OutputConfig output
) {
    /** Default number of developers shown in the summary table. */
    public static final int DEFAULT_TOP = 20;

    /** Default length of the per-developer top file and collaborator lists. */
    public static final int DEFAULT_TOP_FILES = 10;

    /**
     * Creates a default configuration: default weights, no overrides, reports next to the inputs.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(
            new ProjectInfo(null, null),
            Map.of(),
            new RankingConfig(DEFAULT_TOP, 0, DEFAULT_TOP_FILES, Map.of()),
            new OutputConfig(null, List.of())
        );
    }

    /**
     * Returns the repository name: the configured name, or the results directory's name.
     *
     * @param resultsDirectory directory holding the analysis inputs
     * @return repository name used in file names and reports
     */
    public String repositoryName(Path resultsDirectory) {
        if (project != null && project.name() != null && !project.name().isBlank()) {
            return project.name();
        }
        Path absolute = resultsDirectory.toAbsolutePath().normalize();
        return absolute.getFileName() != null ? absolute.getFileName().toString() : "repository";
    }

    /**
     * Returns the configured repository checkout root, or null.
     *
     * @return repository root prefix stripped from complexity paths
     */
    public String repositoryRoot() {
        return project != null ? project.repositoryRoot() : null;
    }

    /**
     * Returns the file name overrides, never null.
     *
     * @return source ID to file name
     */
    public Map<String, String> sourceFileNames() {
        return sources != null ? sources : Map.of();
    }

    /**
     * Returns the weight vector: the defaults with every configured weight applied.
     *
     * <p>The result is not validated here; see
     * {@link com.repoforensics.core.engine.WeightedRanker#validate(WeightVector)}.
     *
     * @return weight vector
     * @throws ConfigurationException if a weight key does not name a signal
     */
    public WeightVector weightVector() {
        WeightVector weights = WeightVector.defaults();
        if (ranking == null || ranking.weights() == null) {
            return weights;
        }
        for (Map.Entry<String, Double> entry : ranking.weights().entrySet()) {
            Signal signal = Signal.fromKey(entry.getKey())
                .orElseThrow(() -> new ConfigurationException("Unknown weight '" + entry.getKey() + "'"));
            if (entry.getValue() == null) {
                throw new ConfigurationException("Weight '" + entry.getKey() + "' has no value");
            }
            weights = weights.with(signal, entry.getValue());
        }
        return weights;
    }

    /**
     * Returns the number of developers to show in the summary table.
     *
     * @return top cutoff
     */
    public int top() {
        return ranking != null && ranking.top() != null ? ranking.top() : DEFAULT_TOP;
    }

    /**
     * Returns the number of developers to show in the detailed breakdown.
     *
     * @return detailed cutoff, 0 disables the breakdown
     */
    public int detailed() {
        return ranking != null && ranking.detailed() != null ? ranking.detailed() : 0;
    }

    /**
     * Returns the length of the per-developer top lists.
     *
     * @return top files cutoff
     */
    public int topFiles() {
        return ranking != null && ranking.topFiles() != null ? ranking.topFiles() : DEFAULT_TOP_FILES;
    }

    /**
     * Project metadata.
     *
     * @param name repository name
     * @param repositoryRoot checkout root used by the complexity tool
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("repositoryRoot") String repositoryRoot
    ) {}

    /**
     * Ranking settings.
     *
     * @param top developers in the summary table
     * @param detailed developers in the detailed breakdown
     * @param topFiles length of the per-developer top lists
     * @param weights weight overrides keyed by signal key
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RankingConfig(
        @JsonProperty("top") Integer top,
        @JsonProperty("detailed") Integer detailed,
        @JsonProperty("topFiles") Integer topFiles,
        @JsonProperty("weights") Map<String, Double> weights
    ) {}

    /**
     * Output configuration.
     *
     * @param directory output directory path, null means the results directory
     * @param formats report format names, empty means all formats
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("formats") List<String> formats
    ) {}
}
