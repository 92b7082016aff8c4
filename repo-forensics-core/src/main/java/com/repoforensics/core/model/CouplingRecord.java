package com.repoforensics.core.model;

import java.util.Objects;

/**
 * Sum of coupling of one file.
 *
 * @param file file path
 * @param sumOfCoupling sum of coupling
 */
public record CouplingRecord(String file, int sumOfCoupling) implements SourceRecord {

    public CouplingRecord {
        Objects.requireNonNull(file, "file must not be null");
    }
}
