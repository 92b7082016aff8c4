package com.repoforensics.core.engine;

import com.repoforensics.core.model.CommitRecord;
import com.repoforensics.core.model.CommunicationRecord;
import com.repoforensics.core.model.ComplexityRecord;
import com.repoforensics.core.model.CouplingRecord;
import com.repoforensics.core.model.DeveloperRanking;
import com.repoforensics.core.model.FragmentationRecord;
import com.repoforensics.core.model.Hotspot;
import com.repoforensics.core.model.HotspotReport;
import com.repoforensics.core.model.MainDeveloperRecord;
import com.repoforensics.core.model.OwnershipRecord;
import com.repoforensics.core.model.QualityGap;
import com.repoforensics.core.model.RankingReport;
import com.repoforensics.core.model.RevisionRecord;
import com.repoforensics.core.model.Signal;
import com.repoforensics.core.model.SourceRecord;
import com.repoforensics.core.source.LoadContext;
import com.repoforensics.core.source.LoadResult;
import com.repoforensics.core.source.SourceLoader;
import com.repoforensics.core.source.SourceLoaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Runs the complete analysis pipeline for one repository.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Validate the weight vector (fails before anything is loaded)</li>
 *   <li>Run every source loader in priority order</li>
 *   <li>Fill the file metrics: revisions, complexity, coupling, fragmentation</li>
 *   <li>Score hotspots</li>
 *   <li>Accumulate developer signals: commits, ownership, main developers, communication</li>
 *   <li>Normalize and rank</li>
 * </ol>
 *
 * <p>Missing sources, skipped rows and unmatched paths never stop the run; they are reported
 * as {@link QualityGap}s.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AnalysisEngine engine = new AnalysisEngine();
 * AnalysisResult result = engine.analyze(AnalysisRequest.from(resultsDir, config));
 * }</pre>
 */
public class AnalysisEngine {

    private static final Logger log = LoggerFactory.getLogger(AnalysisEngine.class);

    private final List<SourceLoader> loaders;
    private final Clock clock;

    /**
     * Creates an engine with every loader registered via ServiceLoader and the system clock.
     */
    public AnalysisEngine() {
        this(SourceLoaders.discover(), Clock.systemUTC());
    }

    /**
     * Creates an engine with explicit loaders and clock.
     *
     * @param loaders source loaders
     * @param clock clock providing the analysis time
     */
    public AnalysisEngine(List<SourceLoader> loaders, Clock clock) {
        Objects.requireNonNull(loaders, "loaders must not be null");
        this.loaders = loaders.stream()
            .sorted(Comparator.comparingInt(SourceLoader::getPriority))
            .toList();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Runs the analysis.
     *
     * @param request analysis inputs
     * @return hotspot table, developer ranking and quality gaps
     * @throws com.repoforensics.core.config.ConfigurationException if the weights are invalid
     */
    public AnalysisResult analyze(AnalysisRequest request) {
        WeightedRanker.validate(request.weights());

        AnalysisContext context = new AnalysisContext(request, clock.instant());
        log.info("Analyzing {} from {}", request.repositoryName(), request.resultsDirectory());

        loadSources(context);
        fillFileMetrics(context);

        HotspotScorer scorer = new HotspotScorer();
        FileMetricsStore store = context.fileMetrics();
        List<Hotspot> hotspots = scorer.score(store);
        int unmatched = scorer.countUnmatched(store);
        log.info("Found {} hotspots ({} files with revisions lack complexity data)", hotspots.size(), unmatched);
        if (unmatched > 0) {
            context.addGap(QualityGap.info("hotspots",
                unmatched + " files with revisions have no matched complexity data and are not scored"));
        }

        Map<String, Hotspot> hotspotsByKey = new HashMap<>();
        for (Hotspot hotspot : hotspots) {
            store.find(hotspot.file()).ifPresent(file -> hotspotsByKey.put(file.key(), hotspot));
        }

        DeveloperMetricsAccumulator accumulator =
            new DeveloperMetricsAccumulator(store, hotspotsByKey, context.analysisTime());
        accumulator.addCommits(records(context, CommitRecord.class));
        accumulator.addOwnership(records(context, OwnershipRecord.class));
        accumulator.addMainDevelopers(records(context, MainDeveloperRecord.class));
        accumulator.addCommunication(records(context, CommunicationRecord.class));
        if (accumulator.unmatchedOwnershipRows() > 0) {
            context.addGap(QualityGap.info("entity-ownership", accumulator.unmatchedOwnershipRows()
                + " ownership rows reference files without revision, complexity, coupling or fragmentation data"));
        }

        List<ScoredDeveloper> scored = new Normalizer().normalize(accumulator.developers());
        List<DeveloperRanking> rankings = new WeightedRanker().rank(scored, request.weights());
        log.info("Ranked {} developers", rankings.size());

        Instant generatedAt = context.analysisTime();
        return new AnalysisResult(
            request.repositoryName(),
            generatedAt,
            new HotspotReport(request.repositoryName(), generatedAt, countWithRevisions(store), unmatched, hotspots),
            new RankingReport(request.repositoryName(), generatedAt, request.weights(), rankings),
            context.qualityGaps(),
            context.loadResults()
        );
    }

    private void loadSources(AnalysisContext context) {
        AnalysisRequest request = context.request();
        LoadContext loadContext = new LoadContext(
            request.resultsDirectory(),
            request.repositoryName(),
            request.repositoryRoot(),
            request.sourceFileNames(),
            Map.of()
        );

        for (SourceLoader loader : loaders) {
            LoadResult result;
            try {
                result = loader.load(loadContext);
            } catch (RuntimeException e) {
                log.error("Loader {} failed: {}", loader.getId(), e.getMessage(), e);
                result = LoadResult.failed(loader.getId(), request.resultsDirectory(), String.valueOf(e.getMessage()));
            }
            context.addLoadResult(result);
            recordLoadGaps(loader, result, context);
        }
    }

    private void recordLoadGaps(SourceLoader loader, LoadResult result, AnalysisContext context) {
        String signals = loader.getAffectedSignals().stream()
            .sorted()
            .map(Signal::key)
            .collect(Collectors.joining(", "));

        switch (result.status()) {
            case MISSING -> context.addGap(QualityGap.warning(loader.getId(),
                "Source not found: " + result.sourceFile() + " (affects " + signals + ")"));
            case FAILED -> context.addGap(QualityGap.error(loader.getId(),
                "Source could not be read: " + result.error() + " (affects " + signals + ")"));
            case LOADED -> {
                if (result.statistics().hasSkips()) {
                    context.addGap(QualityGap.warning(loader.getId(),
                        "Skipped malformed rows. " + result.statistics().getSummary()));
                }
                if (result.records().isEmpty()) {
                    context.addGap(QualityGap.info(loader.getId(), "Source contains no usable records"));
                }
            }
        }
    }

    private void fillFileMetrics(AnalysisContext context) {
        FileMetricsStore store = context.fileMetrics();

        for (RevisionRecord record : records(context, RevisionRecord.class)) {
            store.recordRevisions(record.file(), record.revisions());
        }

        int unmatchedComplexity = 0;
        for (ComplexityRecord record : records(context, ComplexityRecord.class)) {
            if (!store.recordComplexity(record.file(), record.cyclomaticComplexity(), record.linesOfCode())) {
                unmatchedComplexity++;
            }
        }
        reportUnmatched(context, "complexity", unmatchedComplexity);

        int unmatchedCoupling = 0;
        for (CouplingRecord record : records(context, CouplingRecord.class)) {
            if (!store.recordCoupling(record.file(), record.sumOfCoupling())) {
                unmatchedCoupling++;
            }
        }
        reportUnmatched(context, "soc", unmatchedCoupling);

        int unmatchedFragmentation = 0;
        for (FragmentationRecord record : records(context, FragmentationRecord.class)) {
            if (!store.recordFragmentation(record.file(), record.fractalValue())) {
                unmatchedFragmentation++;
            }
        }
        reportUnmatched(context, "fragmentation", unmatchedFragmentation);

        log.debug("File metrics hold {} files", store.size());
    }

    private void reportUnmatched(AnalysisContext context, String sourceId, int unmatched) {
        if (unmatched > 0) {
            log.info("{} {} records did not match a file from the revisions source and were dropped", unmatched, sourceId);
            context.addGap(QualityGap.info(sourceId,
                unmatched + " records did not match a file from the revisions source and were dropped"));
        }
    }

    private <T extends SourceRecord> List<T> records(AnalysisContext context, Class<T> type) {
        List<T> records = new ArrayList<>();
        for (LoadResult result : context.loadResults().values()) {
            records.addAll(result.recordsOf(type));
        }
        return records;
    }

    private int countWithRevisions(FileMetricsStore store) {
        return (int) store.files().stream().filter(FileMetrics::hasRevisions).count();
    }
}
