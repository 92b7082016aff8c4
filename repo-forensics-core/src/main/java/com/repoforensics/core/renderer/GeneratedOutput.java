package com.repoforensics.core.renderer;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reports produced by one run, in generation order.
 *
 * @param files generated reports
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    /**
     * Finds a report by file name.
     *
     * @param fileName file name
     * @return the report, or empty if none has that name
     */
    public Optional<GeneratedFile> find(String fileName) {
        return files.stream()
            .filter(file -> file.fileName().equals(fileName))
            .findFirst();
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}
