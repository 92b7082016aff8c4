package com.repoforensics.core.model;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * One commit from the commit history.
 *
 * @param hash commit hash, may be null
 * @param authorName author display name
 * @param authorEmail author e-mail, may be null
 * @param timestamp commit time, null if the date could not be parsed
 * @param message commit message, may be null
 */
public record CommitRecord(
    String hash,
    String authorName,
    String authorEmail,
    OffsetDateTime timestamp,
    String message
) implements SourceRecord {

    public CommitRecord {
        Objects.requireNonNull(authorName, "authorName must not be null");
    }

    /**
     * Returns true if the commit carries a usable timestamp.
     *
     * @return true if the timestamp was parsed
     */
    public boolean hasTimestamp() {
        return timestamp != null;
    }
}
