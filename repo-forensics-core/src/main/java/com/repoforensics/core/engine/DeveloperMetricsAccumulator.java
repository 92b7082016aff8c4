package com.repoforensics.core.engine;

import com.repoforensics.core.model.Collaborator;
import com.repoforensics.core.model.CommitRecord;
import com.repoforensics.core.model.CommunicationRecord;
import com.repoforensics.core.model.Hotspot;
import com.repoforensics.core.model.MainDeveloperRecord;
import com.repoforensics.core.model.OwnedFile;
import com.repoforensics.core.model.OwnershipRecord;
import com.repoforensics.core.model.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Accumulates the ten raw contribution signals per developer.
 *
 * <ul>
 *   <li>commits: +1 per commit</li>
 *   <li>recency: per commit, +10 / 5 / 2 / 1 / 0.5 for an age of at most 30 / 90 / 180 / 365 days / older</li>
 *   <li>churn: + (added + deleted) per ownership row</li>
 *   <li>hotspot_work: + churn * hotspot_score / 100 on hotspot files</li>
 *   <li>hotspot_commits: +1 per distinct hotspot file touched</li>
 *   <li>complexity: + churn * avg_complexity / 10 on files with complexity data</li>
 *   <li>fragmentation: + churn * fractal_value on files with a fractal value</li>
 *   <li>coupling: + churn * sum_of_coupling / 1000 on files with coupling data</li>
 *   <li>ownership: + ownership fraction per main-developer row</li>
 *   <li>communication: + shared * strength / 10 per communication row</li>
 * </ul>
 *
 * <p>Developers are kept in first-seen order, which is the tie-break order of the ranking.
 */
public class DeveloperMetricsAccumulator {

    private static final Logger log = LoggerFactory.getLogger(DeveloperMetricsAccumulator.class);

    private final FileMetricsStore store;
    private final Map<String, Hotspot> hotspotsByKey;
    private final Instant analysisTime;
    private final Map<String, DeveloperMetrics> developers = new LinkedHashMap<>();

    private int unmatchedOwnershipRows;

    /**
     * Creates an accumulator.
     *
     * @param store file metrics of the run
     * @param hotspotsByKey hotspots keyed by canonical file key
     * @param analysisTime reference time for recency
     */
    public DeveloperMetricsAccumulator(FileMetricsStore store, Map<String, Hotspot> hotspotsByKey, Instant analysisTime) {
        this.store = store;
        this.hotspotsByKey = hotspotsByKey;
        this.analysisTime = analysisTime;
    }

    /**
     * Adds commits: commit count, recency, e-mail and last commit date.
     *
     * @param commits commit records
     */
    public void addCommits(List<CommitRecord> commits) {
        for (CommitRecord commit : commits) {
            DeveloperMetrics developer = developer(commit.authorName());
            developer.add(Signal.COMMITS, 1);
            developer.offerEmail(commit.authorEmail());

            if (commit.hasTimestamp()) {
                developer.offerCommitDate(commit.timestamp());
                long daysAgo = Duration.between(commit.timestamp().toInstant(), analysisTime).toDays();
                developer.add(Signal.RECENCY, recencyWeight(daysAgo));
            }
        }
        log.debug("Accumulated {} commits", commits.size());
    }

    /**
     * Adds ownership rows: churn and every churn-weighted file signal.
     *
     * @param rows ownership records
     */
    public void addOwnership(List<OwnershipRecord> rows) {
        for (OwnershipRecord row : rows) {
            DeveloperMetrics developer = developer(row.author());
            developer.addChurn(row.linesAdded(), row.linesDeleted());
            int churn = row.churn();

            Optional<FileMetrics> match = store.find(row.file());
            if (match.isEmpty()) {
                unmatchedOwnershipRows++;
                log.debug("No file metrics for ownership path '{}'", row.file());
                continue;
            }
            FileMetrics file = match.get();

            Hotspot hotspot = hotspotsByKey.get(file.key());
            if (hotspot != null) {
                developer.add(Signal.HOTSPOT_WORK, churn * hotspot.hotspotScore() / 100.0);
                if (developer.touchHotspot(file.key(), hotspot.file())) {
                    developer.add(Signal.HOTSPOT_COMMITS, 1);
                }
            }
            if (file.hasComplexity()) {
                developer.add(Signal.COMPLEXITY, churn * file.avgComplexity() / 10.0);
            }
            if (file.hasFragmentation()) {
                developer.add(Signal.FRAGMENTATION, churn * file.fragmentation());
            }
            if (file.hasCoupling()) {
                developer.add(Signal.COUPLING, churn * (file.sumOfCoupling() / 1000.0));
            }
        }
        log.debug("Accumulated {} ownership rows ({} without file metrics)", rows.size(), unmatchedOwnershipRows);
    }

    /**
     * Adds main-developer rows: ownership score and owned files.
     *
     * @param rows main-developer records
     */
    public void addMainDevelopers(List<MainDeveloperRecord> rows) {
        for (MainDeveloperRecord row : rows) {
            DeveloperMetrics developer = developer(row.mainDeveloper());
            developer.add(Signal.OWNERSHIP, row.ownership());
            developer.addOwnedFile(new OwnedFile(row.file(), row.ownership()));
        }
    }

    /**
     * Adds communication rows: communication score and collaborators.
     *
     * @param rows communication records
     */
    public void addCommunication(List<CommunicationRecord> rows) {
        for (CommunicationRecord row : rows) {
            DeveloperMetrics developer = developer(row.author());
            developer.add(Signal.COMMUNICATION, row.sharedFiles() * row.strength() / 10.0);
            developer.addCollaborator(new Collaborator(row.peer(), row.sharedFiles(), row.strength()));
        }
    }

    /**
     * Returns all developers in first-seen order.
     *
     * @return developers
     */
    public List<DeveloperMetrics> developers() {
        return new ArrayList<>(developers.values());
    }

    /**
     * Returns the number of ownership rows whose file matched no known file.
     *
     * @return unmatched row count
     */
    public int unmatchedOwnershipRows() {
        return unmatchedOwnershipRows;
    }

    /**
     * Returns the recency weight of a commit.
     *
     * @param daysAgo commit age in whole days
     * @return weight added to the recency signal
     */
    public static double recencyWeight(long daysAgo) {
        if (daysAgo <= 30) {
            return 10.0;
        }
        if (daysAgo <= 90) {
            return 5.0;
        }
        if (daysAgo <= 180) {
            return 2.0;
        }
        if (daysAgo <= 365) {
            return 1.0;
        }
        return 0.5;
    }

    private DeveloperMetrics developer(String name) {
        return developers.computeIfAbsent(name, DeveloperMetrics::new);
    }
}
