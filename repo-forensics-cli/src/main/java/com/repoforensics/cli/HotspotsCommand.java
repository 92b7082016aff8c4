package com.repoforensics.cli;

import com.repoforensics.core.config.ProjectConfig;
import com.repoforensics.core.engine.AnalysisRequest;
import com.repoforensics.core.engine.AnalysisResult;
import com.repoforensics.core.model.Hotspot;
import com.repoforensics.core.report.ReportConfig;
import com.repoforensics.core.report.ReportEmitter;
import com.repoforensics.core.report.ReportFormat;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Command that computes the hotspot table and writes it as JSON and CSV.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * repo-forensics hotspots ./results/my-repo --top 10
 * }</pre>
 */
@Command(
    name = "hotspots",
    description = "Compute change-frequency x complexity hotspots",
    mixinStandardHelpOptions = true
)
public class HotspotsCommand extends AbstractAnalysisCommand {

    @Override
    protected int execute(ProjectConfig config, AnalysisRequest request) {
        System.out.println("Analyzing results in: " + resultsDir.toAbsolutePath());
        AnalysisResult result = createEngine().analyze(request);
        List<Hotspot> hotspots = result.hotspots().hotspots();

        System.out.println();
        System.out.printf("Hotspots: %d of %d files with revisions (%d without complexity data)%n",
            hotspots.size(), result.hotspots().filesWithRevisions(), result.hotspots().unmatchedFiles());
        System.out.printf("%-10s %-9s %-10s %-8s %s%n", "Score", "Risk", "Revisions", "AvgCC", "File");
        for (Hotspot hotspot : hotspots.subList(0, Math.min(top(config), hotspots.size()))) {
            System.out.printf(Locale.ROOT, "%-10.2f %-9s %-10d %-8.2f %s%n",
                hotspot.hotspotScore(), hotspot.riskLevel(), hotspot.revisions(),
                hotspot.avgComplexity(), hotspot.file());
        }
        printQualityGaps(result);

        ReportConfig reportConfig = new ReportConfig(top(config), 0, config.topFiles(), Map.of());
        write(new ReportEmitter().emit(result, List.of(ReportFormat.HOTSPOTS_JSON, ReportFormat.HOTSPOTS_CSV),
            reportConfig), outputDirectory(config));
        return EXIT_OK;
    }
}
