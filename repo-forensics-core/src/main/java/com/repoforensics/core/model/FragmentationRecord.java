package com.repoforensics.core.model;

import java.util.Objects;

/**
 * Fractal (fragmentation) value of one file.
 *
 * @param file file path
 * @param fractalValue fragmentation value
 */
public record FragmentationRecord(String file, double fractalValue) implements SourceRecord {

    public FragmentationRecord {
        Objects.requireNonNull(file, "file must not be null");
    }
}
