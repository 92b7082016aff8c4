package com.repoforensics.core.engine;

import com.repoforensics.core.config.ConfigurationException;
import com.repoforensics.core.model.DeveloperRanking;
import com.repoforensics.core.model.Signal;
import com.repoforensics.core.model.WeightVector;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Combines normalized signals into a composite score and ranks developers.
 *
 * <p>{@code composite = sum(normalized_i * weight_i)}. Developers are sorted by descending
 * composite score; equal scores keep their input order. Ranks run from 1 to n without gaps
 * or repeats.
 */
public class WeightedRanker {

    /**
     * Checks that a weight vector can be used for ranking.
     *
     * @param weights weight vector
     * @throws ConfigurationException if a weight is negative or not finite, or the sum is not
     *     1.0 within {@link WeightVector#TOLERANCE}
     */
    public static void validate(WeightVector weights) {
        for (Map.Entry<Signal, Double> entry : weights.weights().entrySet()) {
            double weight = entry.getValue();
            if (Double.isNaN(weight) || Double.isInfinite(weight) || weight < 0.0) {
                throw new ConfigurationException(
                    "Weight for " + entry.getKey().key() + " must be a non-negative number, got " + weight);
            }
        }
        double sum = weights.sum();
        if (Math.abs(sum - 1.0) > WeightVector.TOLERANCE) {
            throw new ConfigurationException(String.format(
                "Weights must sum to 1.0 (+/- %s), got %.4f", WeightVector.TOLERANCE, sum));
        }
    }

    /**
     * Ranks developers. The weights are validated before any developer is looked at.
     *
     * @param developers developers with normalized values, in tie-break order
     * @param weights weight vector
     * @return rankings ordered by rank
     * @throws ConfigurationException if the weights are invalid
     */
    public List<DeveloperRanking> rank(List<ScoredDeveloper> developers, WeightVector weights) {
        validate(weights);

        List<ScoredDeveloper> ordered = new ArrayList<>(developers);
        ordered.sort(Comparator.comparingDouble((ScoredDeveloper d) -> composite(d, weights)).reversed());

        List<DeveloperRanking> rankings = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            ScoredDeveloper scored = ordered.get(i);
            DeveloperMetrics metrics = scored.metrics();
            rankings.add(new DeveloperRanking(
                i + 1,
                metrics.name(),
                metrics.email(),
                composite(scored, weights),
                metrics.rawScores(),
                scored.normalized(),
                metrics.linesAdded(),
                metrics.linesDeleted(),
                metrics.lastCommitDate(),
                metrics.ownedFiles(),
                metrics.hotspotFiles(),
                metrics.collaborators()
            ));
        }
        return rankings;
    }

    /**
     * Computes the composite score of a developer.
     *
     * @param developer developer with normalized values
     * @param weights weight vector
     * @return weighted sum of normalized values
     */
    public static double composite(ScoredDeveloper developer, WeightVector weights) {
        double score = 0.0;
        for (Signal signal : Signal.values()) {
            score += developer.normalized(signal) * weights.weight(signal);
        }
        return score;
    }
}
