package com.repoforensics.core.engine;

import com.repoforensics.core.model.Hotspot;
import com.repoforensics.core.model.RiskLevel;
import com.repoforensics.core.util.Rounding;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scores files that have both revision and complexity data.
 *
 * <pre>
 * hotspot_score = round((revisions / 10) * (avg_complexity / 5) * 10, 2)
 * </pre>
 *
 * <p>Risk is classified by the first matching rule:
 * <ul>
 *   <li>revisions &gt;= 50 and avg &gt;= 15: CRITICAL</li>
 *   <li>revisions &gt;= 50 and avg &gt;= 8: HIGH</li>
 *   <li>revisions &gt;= 30 and avg &gt;= 8: HIGH</li>
 *   <li>revisions &gt;= 20 or avg &gt;= 10: MEDIUM</li>
 *   <li>otherwise LOW</li>
 * </ul>
 *
 * <p>The scorer reads the store but never changes it.
 */
public class HotspotScorer {

    /**
     * Scores every file with revisions and matched complexity.
     *
     * @param store file metrics of the run
     * @return hotspots sorted by descending score; ties keep store order
     */
    public List<Hotspot> score(FileMetricsStore store) {
        List<Hotspot> hotspots = new ArrayList<>();
        for (FileMetrics file : store.files()) {
            if (!file.hasRevisions() || !file.hasComplexity()) {
                continue;
            }
            double avg = file.avgComplexity();
            hotspots.add(new Hotspot(
                file.path(),
                hotspotScore(file.revisions(), avg),
                classify(file.revisions(), avg),
                file.revisions(),
                Rounding.round2(avg),
                file.maxComplexity(),
                file.functionCount(),
                file.totalLinesOfCode()
            ));
        }
        hotspots.sort(Comparator.comparingDouble(Hotspot::hotspotScore).reversed());
        return hotspots;
    }

    /**
     * Counts files with revisions whose complexity could not be matched.
     *
     * @param store file metrics of the run
     * @return number of files excluded from the hotspot table
     */
    public int countUnmatched(FileMetricsStore store) {
        return (int) store.files().stream()
            .filter(file -> file.hasRevisions() && !file.hasComplexity())
            .count();
    }

    /**
     * Computes the hotspot score.
     *
     * @param revisions revision count
     * @param avgComplexity average cyclomatic complexity
     * @return score rounded to two decimals
     */
    public static double hotspotScore(int revisions, double avgComplexity) {
        return Rounding.round2((revisions / 10.0) * (avgComplexity / 5.0) * 10.0);
    }

    /**
     * Classifies change risk.
     *
     * @param revisions revision count
     * @param avgComplexity average cyclomatic complexity
     * @return risk level
     */
    public static RiskLevel classify(int revisions, double avgComplexity) {
        if (revisions >= 50 && avgComplexity >= 15) {
            return RiskLevel.CRITICAL;
        }
        if (revisions >= 50 && avgComplexity >= 8) {
            return RiskLevel.HIGH;
        }
        if (revisions >= 30 && avgComplexity >= 8) {
            return RiskLevel.HIGH;
        }
        if (revisions >= 20 || avgComplexity >= 10) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }
}
