package com.repoforensics.core.engine;

import com.repoforensics.core.model.Collaborator;
import com.repoforensics.core.model.OwnedFile;
import com.repoforensics.core.model.Signal;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable per-developer accumulator for one analysis run.
 *
 * <p>Developers are identified by display name only; two spellings of the same person are
 * two developers.
 */
public class DeveloperMetrics {

    private final String name;
    private final Map<Signal, Double> raw = new EnumMap<>(Signal.class);
    private final List<OwnedFile> ownedFiles = new ArrayList<>();
    private final Map<String, String> hotspotFiles = new LinkedHashMap<>();
    private final Map<String, Collaborator> collaborators = new LinkedHashMap<>();

    private String email;
    private long linesAdded;
    private long linesDeleted;
    private OffsetDateTime lastCommitDate;

    DeveloperMetrics(String name) {
        this.name = name;
        for (Signal signal : Signal.values()) {
            raw.put(signal, 0.0);
        }
    }

    void add(Signal signal, double amount) {
        raw.merge(signal, amount, Double::sum);
    }

    void addChurn(int added, int deleted) {
        linesAdded += added;
        linesDeleted += deleted;
        add(Signal.CHURN, added + deleted);
    }

    void offerEmail(String candidate) {
        if (email == null && candidate != null && !candidate.isBlank()) {
            email = candidate;
        }
    }

    void offerCommitDate(OffsetDateTime date) {
        if (lastCommitDate == null || date.isAfter(lastCommitDate)) {
            lastCommitDate = date;
        }
    }

    void addOwnedFile(OwnedFile file) {
        ownedFiles.add(file);
    }

    /**
     * Records a touched hotspot file.
     *
     * @return true on the first touch of this file
     */
    boolean touchHotspot(String key, String path) {
        return hotspotFiles.putIfAbsent(key, path) == null;
    }

    void addCollaborator(Collaborator collaborator) {
        collaborators.putIfAbsent(collaborator.name(), collaborator);
    }

    public String name() {
        return name;
    }

    public String email() {
        return email;
    }

    /**
     * Returns the raw value of a signal.
     *
     * @param signal the signal
     * @return accumulated value, 0 if nothing contributed
     */
    public double raw(Signal signal) {
        return raw.get(signal);
    }

    public Map<Signal, Double> rawScores() {
        return Collections.unmodifiableMap(raw);
    }

    public long linesAdded() {
        return linesAdded;
    }

    public long linesDeleted() {
        return linesDeleted;
    }

    public OffsetDateTime lastCommitDate() {
        return lastCommitDate;
    }

    public List<OwnedFile> ownedFiles() {
        return Collections.unmodifiableList(ownedFiles);
    }

    public List<String> hotspotFiles() {
        return List.copyOf(hotspotFiles.values());
    }

    public List<Collaborator> collaborators() {
        return List.copyOf(collaborators.values());
    }
}
