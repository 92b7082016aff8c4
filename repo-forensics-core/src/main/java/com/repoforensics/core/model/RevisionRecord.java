package com.repoforensics.core.model;

import java.util.Objects;

/**
 * Revision count of one file.
 *
 * @param file file path
 * @param revisions number of revisions, never negative
 */
public record RevisionRecord(String file, int revisions) implements SourceRecord {

    public RevisionRecord {
        Objects.requireNonNull(file, "file must not be null");
        if (revisions < 0) {
            throw new IllegalArgumentException("revisions must not be negative: " + revisions);
        }
    }
}
