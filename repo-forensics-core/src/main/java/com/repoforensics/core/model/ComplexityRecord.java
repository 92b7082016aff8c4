package com.repoforensics.core.model;

import java.util.Objects;

/**
 * Complexity measurement of one function.
 *
 * @param file file containing the function
 * @param functionName function name, may be null
 * @param cyclomaticComplexity cyclomatic complexity of the function
 * @param linesOfCode non-comment lines of code of the function
 */
public record ComplexityRecord(
    String file,
    String functionName,
    int cyclomaticComplexity,
    int linesOfCode
) implements SourceRecord {

    public ComplexityRecord {
        Objects.requireNonNull(file, "file must not be null");
    }
}
