package com.repoforensics.core.report.impl;

import com.repoforensics.core.engine.AnalysisResult;
import com.repoforensics.core.model.Collaborator;
import com.repoforensics.core.model.DeveloperRanking;
import com.repoforensics.core.model.Hotspot;
import com.repoforensics.core.model.Signal;
import com.repoforensics.core.model.WeightVector;
import com.repoforensics.core.report.GeneratedReport;
import com.repoforensics.core.report.ReportConfig;
import com.repoforensics.core.report.ReportFormat;
import com.repoforensics.core.report.ReportGenerator;
import com.repoforensics.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Renders a plain-text ranking summary for terminals and log files.
 *
 * <p>The summary contains the weighting scheme, the ranked table truncated to
 * {@link ReportConfig#top()} rows, an optional per-developer breakdown for the first
 * {@link ReportConfig#detailed()} developers, and the highest-scoring hotspots.
 */
public class TextReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(TextReportGenerator.class);

    static final int WIDTH = 140;
    static final int NAME_WIDTH = 39;
    static final int TOP_COLLABORATORS = 3;

    private static final String NEWLINE = "\n";
    private static final String HEAVY_RULE = "=".repeat(WIDTH);
    private static final String LIGHT_RULE = "-".repeat(WIDTH);
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    @Override
    public String getId() {
        return "text";
    }

    @Override
    public String getDisplayName() {
        return "Text Summary Generator";
    }

    @Override
    public Set<ReportFormat> getSupportedFormats() {
        return Set.of(ReportFormat.SUMMARY_TEXT);
    }

    @Override
    public GeneratedReport generate(AnalysisResult result, ReportFormat format, ReportConfig config) {
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(config, "config must not be null");
        if (format != ReportFormat.SUMMARY_TEXT) {
            throw new IllegalArgumentException("Unsupported report format: " + format);
        }

        StringBuilder sb = new StringBuilder();
        appendRankingTable(sb, result, config.top());
        if (config.detailed() > 0) {
            appendBreakdown(sb, result, config.detailed());
        }
        appendHotspots(sb, result, config.top());

        log.debug("Rendered summary for {} developers", result.ranking().totalDevelopers());
        return new GeneratedReport(format, config.fileName(format, result.repository()), sb.toString());
    }

    private void appendRankingTable(StringBuilder sb, AnalysisResult result, int top) {
        WeightVector weights = result.ranking().weights();

        sb.append(HEAVY_RULE).append(NEWLINE);
        sb.append(center("DEVELOPER RANKING REPORT")).append(NEWLINE);
        sb.append("Repository: ").append(result.repository()).append(NEWLINE);
        sb.append(HEAVY_RULE).append(NEWLINE).append(NEWLINE);

        sb.append("Weighting Scheme:").append(NEWLINE);
        appendWeights(sb, weights, Signal.COMMITS, Signal.CHURN, Signal.HOTSPOT_WORK, Signal.OWNERSHIP);
        appendWeights(sb, weights, Signal.COMPLEXITY, Signal.COMMUNICATION, Signal.RECENCY, Signal.FRAGMENTATION);
        appendWeights(sb, weights, Signal.COUPLING, Signal.HOTSPOT_COMMITS);
        sb.append(NEWLINE).append(HEAVY_RULE).append(NEWLINE);

        sb.append(String.format(Locale.ROOT, "%-6s %-40s %-8s %-8s %-11s %-10s %-8s %-8s",
            "Rank", "Developer", "Score", "Commits", "Churn", "Hotspots", "Owned", "Collab")).append(NEWLINE);
        sb.append(LIGHT_RULE).append(NEWLINE);

        List<DeveloperRanking> rankings = result.ranking().rankings();
        for (DeveloperRanking developer : rankings.subList(0, Math.min(top, rankings.size()))) {
            sb.append(String.format(Locale.ROOT, "%-6d %-40s %6.1f  %6d  %10d  %9d  %7d  %7d",
                developer.rank(),
                FileUtils.truncate(developer.developer(), NAME_WIDTH),
                developer.compositeScore(),
                Math.round(developer.raw(Signal.COMMITS)),
                developer.totalChurn(),
                developer.hotspotFiles().size(),
                developer.ownedFiles().size(),
                developer.collaborators().size())).append(NEWLINE);
        }
        if (rankings.isEmpty()) {
            sb.append("No developers found").append(NEWLINE);
        }
        sb.append(HEAVY_RULE).append(NEWLINE);
    }

    private void appendWeights(StringBuilder sb, WeightVector weights, Signal... signals) {
        sb.append("  ");
        for (int i = 0; i < signals.length; i++) {
            if (i > 0) {
                sb.append(" | ");
            }
            sb.append(signals[i].displayName()).append(": ")
                .append(String.format(Locale.ROOT, "%.0f%%", weights.weight(signals[i]) * 100.0));
        }
        sb.append(NEWLINE);
    }

    private void appendBreakdown(StringBuilder sb, AnalysisResult result, int detailed) {
        List<DeveloperRanking> rankings = result.ranking().rankings();
        List<DeveloperRanking> shown = rankings.subList(0, Math.min(detailed, rankings.size()));

        sb.append(NEWLINE).append(HEAVY_RULE).append(NEWLINE);
        sb.append(center("DETAILED BREAKDOWN - TOP " + detailed + " DEVELOPERS")).append(NEWLINE);
        sb.append(HEAVY_RULE).append(NEWLINE).append(NEWLINE);

        for (DeveloperRanking developer : shown) {
            sb.append("Rank #").append(developer.rank()).append(": ").append(developer.developer()).append(NEWLINE);
            sb.append("  Email: ").append(developer.email() != null ? developer.email() : "N/A").append(NEWLINE);
            sb.append(String.format(Locale.ROOT, "  Overall Score: %.2f/100", developer.compositeScore())).append(NEWLINE);
            sb.append(NEWLINE).append("  Metrics:").append(NEWLINE);

            sb.append(String.format(Locale.ROOT, "    - Commits: %d (normalized: %.1f)",
                Math.round(developer.raw(Signal.COMMITS)), developer.normalized(Signal.COMMITS))).append(NEWLINE);
            sb.append(String.format(Locale.ROOT, "    - Code Churn: %,d added, %,d deleted (normalized: %.1f)",
                developer.linesAdded(), developer.linesDeleted(), developer.normalized(Signal.CHURN))).append(NEWLINE);
            for (Signal signal : List.of(Signal.HOTSPOT_WORK, Signal.OWNERSHIP, Signal.COMPLEXITY,
                    Signal.COMMUNICATION, Signal.RECENCY, Signal.FRAGMENTATION, Signal.COUPLING)) {
                sb.append(String.format(Locale.ROOT, "    - %s: %.1f (normalized: %.1f)",
                    signal.displayName(), developer.raw(signal), developer.normalized(signal))).append(NEWLINE);
            }
            sb.append(String.format(Locale.ROOT, "    - Hotspot Commits: %d (normalized: %.1f)",
                Math.round(developer.raw(Signal.HOTSPOT_COMMITS)), developer.normalized(Signal.HOTSPOT_COMMITS)))
                .append(NEWLINE);

            if (developer.lastCommitDate() != null) {
                long daysAgo = daysBetween(developer.lastCommitDate().toInstant(), result.generatedAt());
                sb.append("    - Last Active: ").append(daysAgo).append(" days ago (")
                    .append(DAY.format(developer.lastCommitDate())).append(")").append(NEWLINE);
            }

            sb.append(NEWLINE).append("  Files: ").append(developer.ownedFiles().size()).append(" owned, ")
                .append(developer.hotspotFiles().size()).append(" hotspots").append(NEWLINE);
            sb.append("  Collaborators: ").append(developer.collaborators().size()).append(NEWLINE);
            appendTopCollaborators(sb, developer.collaborators());
            sb.append(LIGHT_RULE).append(NEWLINE).append(NEWLINE);
        }
    }

    private void appendTopCollaborators(StringBuilder sb, List<Collaborator> collaborators) {
        if (collaborators.isEmpty()) {
            return;
        }
        sb.append("  Top Collaborators:").append(NEWLINE);
        collaborators.stream()
            .sorted(Comparator.comparingInt(Collaborator::strength).reversed())
            .limit(TOP_COLLABORATORS)
            .forEach(c -> sb.append("    - ").append(c.name())
                .append(" (strength: ").append(c.strength())
                .append(", shared: ").append(c.sharedFiles()).append(")").append(NEWLINE));
    }

    private void appendHotspots(StringBuilder sb, AnalysisResult result, int top) {
        List<Hotspot> hotspots = result.hotspots().hotspots();

        sb.append(NEWLINE).append("Top Hotspots (").append(hotspots.size()).append(" total):").append(NEWLINE);
        if (hotspots.isEmpty()) {
            sb.append("  No hotspots found").append(NEWLINE);
            return;
        }
        for (Hotspot hotspot : hotspots.subList(0, Math.min(top, hotspots.size()))) {
            sb.append(String.format(Locale.ROOT, "  %8.2f  %-8s  %s (revisions: %d, avg complexity: %.2f)",
                hotspot.hotspotScore(), hotspot.riskLevel(), hotspot.file(),
                hotspot.revisions(), hotspot.avgComplexity())).append(NEWLINE);
        }
    }

    static long daysBetween(Instant then, Instant now) {
        return Duration.between(then, now).toDays();
    }

    private static String center(String text) {
        int padding = Math.max(0, (WIDTH - text.length()) / 2);
        return " ".repeat(padding) + text;
    }
}
