package com.repoforensics.core.engine;

import com.repoforensics.core.config.ProjectConfig;
import com.repoforensics.core.model.WeightVector;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Inputs of one analysis run.
 *
 * @param resultsDirectory directory holding the analysis inputs
 * @param repositoryName repository name
 * @param repositoryRoot checkout root stripped from complexity paths, may be null
 * @param sourceFileNames file name overrides keyed by loader ID
 * @param weights weight vector, validated when the run starts
 */
public record AnalysisRequest(
    Path resultsDirectory,
    String repositoryName,
    String repositoryRoot,
    Map<String, String> sourceFileNames,
    WeightVector weights
) {
    /**
     * Compact constructor with validation.
     */
    public AnalysisRequest {
        Objects.requireNonNull(resultsDirectory, "resultsDirectory must not be null");
        Objects.requireNonNull(repositoryName, "repositoryName must not be null");
        Objects.requireNonNull(weights, "weights must not be null");
        sourceFileNames = sourceFileNames == null ? Map.of() : Map.copyOf(sourceFileNames);
    }

    /**
     * Creates a request from a project configuration.
     *
     * @param resultsDirectory directory holding the analysis inputs
     * @param config project configuration
     * @return request using the configured names and weights
     */
    public static AnalysisRequest from(Path resultsDirectory, ProjectConfig config) {
        return new AnalysisRequest(
            resultsDirectory,
            config.repositoryName(resultsDirectory),
            config.repositoryRoot(),
            config.sourceFileNames(),
            config.weightVector()
        );
    }

    /**
     * Returns a copy of this request with other weights.
     *
     * @param newWeights weight vector
     * @return new request
     */
    public AnalysisRequest withWeights(WeightVector newWeights) {
        return new AnalysisRequest(resultsDirectory, repositoryName, repositoryRoot, sourceFileNames, newWeights);
    }
}
