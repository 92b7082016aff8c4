package com.repoforensics.core.model;

import java.util.Objects;

/**
 * Main developer of one file.
 *
 * @param file file path
 * @param mainDeveloper author display name
 * @param ownership ownership fraction in [0, 1]
 */
public record MainDeveloperRecord(String file, String mainDeveloper, double ownership) implements SourceRecord {

    public MainDeveloperRecord {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(mainDeveloper, "mainDeveloper must not be null");
    }
}
