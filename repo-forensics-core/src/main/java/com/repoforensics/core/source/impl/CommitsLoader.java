package com.repoforensics.core.source.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.repoforensics.core.model.CommitRecord;
import com.repoforensics.core.model.Signal;
import com.repoforensics.core.model.SourceRecord;
import com.repoforensics.core.source.LoadContext;
import com.repoforensics.core.source.base.AbstractJsonSourceLoader;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.Set;

/**
 * Loads the commit history ({@code {"commits": [...]}}).
 *
 * <p>Commits without an author name are attributed to {@value #UNKNOWN_AUTHOR}. A commit whose
 * date cannot be parsed is still counted; it only lacks a timestamp, so it contributes nothing
 * to recency.
 */
public class CommitsLoader extends AbstractJsonSourceLoader {

    static final String UNKNOWN_AUTHOR = "Unknown";

    private static final DateTimeFormatter GIT_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss Z");

    @Override
    public String getId() {
        return "commits";
    }

    @Override
    public String getDisplayName() {
        return "Commit History";
    }

    @Override
    public String getDefaultFileName() {
        return "commits.json";
    }

    @Override
    public Set<Signal> getAffectedSignals() {
        return Set.of(Signal.COMMITS, Signal.RECENCY);
    }

    @Override
    public int getPriority() {
        return 50;
    }

    @Override
    protected JsonNode selectRecords(JsonNode root) {
        return root.isArray() ? root : root.path("commits");
    }

    @Override
    protected SourceRecord parseRecord(JsonNode node, LoadContext context) {
        String hash = extractText(node, "hash");
        String author = getTextOrDefault(node, "author_name", UNKNOWN_AUTHOR);
        String date = extractText(node, "date");

        OffsetDateTime timestamp = null;
        if (date != null) {
            timestamp = parseDate(date).orElse(null);
            if (timestamp == null) {
                log.warn("Commit {} by {} has unparseable date '{}'; counted without recency", hash, author, date);
            }
        }

        return new CommitRecord(hash, author, extractText(node, "author_email"), timestamp, extractText(node, "message"));
    }

    /**
     * Parses a commit date. Accepts ISO-8601 with offset or {@code Z}, ISO-8601 without offset
     * (read as UTC), and git's {@code yyyy-MM-dd HH:mm:ss Z}.
     *
     * @param value date text
     * @return parsed timestamp, or empty if no format matches
     */
    static Optional<OffsetDateTime> parseDate(String value) {
        String text = value.trim();
        try {
            return Optional.of(OffsetDateTime.parse(text));
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return Optional.of(LocalDateTime.parse(text).atOffset(ZoneOffset.UTC));
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return Optional.of(OffsetDateTime.parse(text, GIT_DATE));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
