package com.repoforensics.core.model;

import java.util.Objects;

/**
 * A file for which a developer is the main developer.
 *
 * @param file file path as reported by the main-developer source
 * @param ownership ownership fraction in [0, 1]
 */
public record OwnedFile(String file, double ownership) {

    public OwnedFile {
        Objects.requireNonNull(file, "file must not be null");
    }
}
