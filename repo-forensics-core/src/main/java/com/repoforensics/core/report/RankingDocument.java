package com.repoforensics.core.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.repoforensics.core.engine.AnalysisResult;
import com.repoforensics.core.model.Collaborator;
import com.repoforensics.core.model.DeveloperRanking;
import com.repoforensics.core.model.OwnedFile;
import com.repoforensics.core.model.QualityGap;
import com.repoforensics.core.model.RankingReport;
import com.repoforensics.core.model.Signal;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON representation of a developer ranking.
 *
 * <p>Scores are kept at full precision so that a written report can be read back with
 * {@link RankingReportReader} and reproduce the same order and composite scores.
 *
 * @param repository repository name
 * @param totalDevelopers number of ranked developers
 * @param weights weight per signal key
 * @param generatedAt analysis time (ISO-8601)
 * @param rankings one entry per developer, by rank
 * @param qualityGaps problems found while loading the inputs
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RankingDocument(
    @JsonProperty("repository") String repository,
    @JsonProperty("total_developers") int totalDevelopers,
    @JsonProperty("weights") Map<String, Double> weights,
    @JsonProperty("generated_at") String generatedAt,
    @JsonProperty("rankings") List<Entry> rankings,
    @JsonProperty("quality_gaps") List<QualityGap> qualityGaps
) {
    /**
     * Builds the document for an analysis result.
     *
     * @param result analysis result
     * @param topFiles length of the per-developer top lists
     * @return ranking document
     */
    public static RankingDocument from(AnalysisResult result, int topFiles) {
        RankingReport ranking = result.ranking();
        List<Entry> entries = ranking.rankings().stream()
            .map(developer -> Entry.from(developer, topFiles))
            .toList();
        return new RankingDocument(
            ranking.repository(),
            ranking.totalDevelopers(),
            ranking.weights().toKeyedMap(),
            ranking.generatedAt().toString(),
            entries,
            result.qualityGaps()
        );
    }

    /**
     * One ranked developer.
     *
     * @param rank 1-based rank
     * @param developer author display name
     * @param email author e-mail, may be null
     * @param weightedScore composite score
     * @param metrics raw values and counts
     * @param normalizedScores normalized value per signal key
     * @param topHotspotFiles hotspot files touched, in first-touch order
     * @param topOwnedFiles owned files by descending ownership
     * @param topCollaborators collaborators by descending strength
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(
        @JsonProperty("rank") int rank,
        @JsonProperty("developer") String developer,
        @JsonProperty("email") String email,
        @JsonProperty("weighted_score") double weightedScore,
        @JsonProperty("metrics") Metrics metrics,
        @JsonProperty("normalized_scores") Map<String, Double> normalizedScores,
        @JsonProperty("top_hotspot_files") List<String> topHotspotFiles,
        @JsonProperty("top_owned_files") List<OwnedFile> topOwnedFiles,
        @JsonProperty("top_collaborators") List<CollaboratorEntry> topCollaborators
    ) {
        static Entry from(DeveloperRanking developer, int topFiles) {
            Map<String, Double> normalized = new LinkedHashMap<>();
            for (Signal signal : Signal.values()) {
                normalized.put(signal.key(), developer.normalized(signal));
            }
            return new Entry(
                developer.rank(),
                developer.developer(),
                developer.email(),
                developer.compositeScore(),
                Metrics.from(developer),
                normalized,
                developer.hotspotFiles().stream().limit(topFiles).toList(),
                developer.ownedFiles().stream()
                    .sorted(Comparator.comparingDouble(OwnedFile::ownership).reversed())
                    .limit(topFiles)
                    .toList(),
                developer.collaborators().stream()
                    .sorted(Comparator.comparingInt(Collaborator::strength).reversed())
                    .limit(topFiles)
                    .map(CollaboratorEntry::from)
                    .toList()
            );
        }
    }

    /**
     * Raw values and counts of one developer.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Metrics(
        @JsonProperty("commits") long commits,
        @JsonProperty("lines_added") long linesAdded,
        @JsonProperty("lines_deleted") long linesDeleted,
        @JsonProperty("total_churn") long totalChurn,
        @JsonProperty("hotspot_score") double hotspotScore,
        @JsonProperty("hotspot_files_count") int hotspotFilesCount,
        @JsonProperty("hotspot_commits") long hotspotCommits,
        @JsonProperty("ownership_score") double ownershipScore,
        @JsonProperty("files_owned_count") int filesOwnedCount,
        @JsonProperty("complexity_score") double complexityScore,
        @JsonProperty("communication_score") double communicationScore,
        @JsonProperty("collaborators_count") int collaboratorsCount,
        @JsonProperty("recency_score") double recencyScore,
        @JsonProperty("fragmentation_score") double fragmentationScore,
        @JsonProperty("coupling_score") double couplingScore,
        @JsonProperty("last_commit_date") String lastCommitDate
    ) {
        static Metrics from(DeveloperRanking developer) {
            return new Metrics(
                Math.round(developer.raw(Signal.COMMITS)),
                developer.linesAdded(),
                developer.linesDeleted(),
                developer.totalChurn(),
                developer.raw(Signal.HOTSPOT_WORK),
                developer.hotspotFiles().size(),
                Math.round(developer.raw(Signal.HOTSPOT_COMMITS)),
                developer.raw(Signal.OWNERSHIP),
                developer.ownedFiles().size(),
                developer.raw(Signal.COMPLEXITY),
                developer.raw(Signal.COMMUNICATION),
                developer.collaborators().size(),
                developer.raw(Signal.RECENCY),
                developer.raw(Signal.FRAGMENTATION),
                developer.raw(Signal.COUPLING),
                developer.lastCommitDate() != null ? developer.lastCommitDate().toString() : null
            );
        }
    }

    /**
     * A collaboration partner.
     *
     * @param name peer name
     * @param sharedFiles files changed by both
     * @param strength collaboration strength
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CollaboratorEntry(
        @JsonProperty("name") String name,
        @JsonProperty("shared_files") int sharedFiles,
        @JsonProperty("strength") int strength
    ) {
        static CollaboratorEntry from(Collaborator collaborator) {
            return new CollaboratorEntry(collaborator.name(), collaborator.sharedFiles(), collaborator.strength());
        }
    }
}
