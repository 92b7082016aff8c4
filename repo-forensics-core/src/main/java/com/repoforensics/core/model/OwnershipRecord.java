package com.repoforensics.core.model;

import java.util.Objects;

/**
 * Lines one author added to and deleted from one file.
 *
 * @param file file path
 * @param author author display name
 * @param linesAdded lines added
 * @param linesDeleted lines deleted
 */
public record OwnershipRecord(
    String file,
    String author,
    int linesAdded,
    int linesDeleted
) implements SourceRecord {

    public OwnershipRecord {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(author, "author must not be null");
    }

    /**
     * Returns lines added plus lines deleted.
     *
     * @return churn of this record
     */
    public int churn() {
        return linesAdded + linesDeleted;
    }
}
