package com.repoforensics.core.source;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Statistics collected while decoding one source.
 *
 * <p>Provides transparency into how many rows were usable. Used for quality gaps and
 * troubleshooting inputs produced by upstream tools.
 *
 * @param rowsRead data rows read (header excluded)
 * @param rowsAccepted rows decoded into records
 * @param rowsSkipped rows skipped as malformed
 * @param errorCounts number of skipped rows per reason
 * @param topErrors first skip messages (max 10)
 */
public record LoadStatistics(
    int rowsRead,
    int rowsAccepted,
    int rowsSkipped,
    Map<String, Integer> errorCounts,
    List<String> topErrors
) {
    /** Maximum number of messages kept in {@link #topErrors()}. */
    public static final int MAX_TOP_ERRORS = 10;

    /**
     * Compact constructor with validation and defaults.
     */
    public LoadStatistics {
        if (rowsRead < 0) {
            rowsRead = 0;
        }
        if (rowsAccepted < 0) {
            rowsAccepted = 0;
        }
        if (rowsSkipped < 0) {
            rowsSkipped = 0;
        }
        if (errorCounts == null) {
            errorCounts = Map.of();
        }
        if (topErrors == null) {
            topErrors = List.of();
        }
    }

    /**
     * Creates an empty statistics instance (nothing read).
     *
     * @return empty statistics
     */
    public static LoadStatistics empty() {
        return new LoadStatistics(0, 0, 0, Map.of(), List.of());
    }

    /**
     * Calculates the share of rows that had to be skipped.
     *
     * @return skip rate as percentage (0.0 to 100.0), or 0 if no rows were read
     */
    public double getSkipRate() {
        if (rowsRead == 0) {
            return 0.0;
        }
        return (rowsSkipped * 100.0) / rowsRead;
    }

    /**
     * Returns true if any row was skipped.
     *
     * @return true if at least one row was malformed
     */
    public boolean hasSkips() {
        return rowsSkipped > 0;
    }

    /**
     * Returns a human-readable summary of the statistics.
     *
     * @return summary string
     */
    public String getSummary() {
        return String.format("Read: %d, Accepted: %d, Skipped: %d (%.1f%%)",
            rowsRead, rowsAccepted, rowsSkipped, getSkipRate());
    }

    /**
     * Builder for constructing LoadStatistics incrementally.
     */
    public static class Builder {
        private int rowsRead = 0;
        private int rowsAccepted = 0;
        private int rowsSkipped = 0;
        private final Map<String, Integer> errorCounts = new HashMap<>();
        private final List<String> topErrors = new ArrayList<>();

        public Builder incrementRowsRead() {
            this.rowsRead++;
            return this;
        }

        public Builder incrementRowsAccepted() {
            this.rowsAccepted++;
            return this;
        }

        public Builder addSkip(String reason, String detail) {
            this.rowsSkipped++;
            errorCounts.merge(reason, 1, Integer::sum);
            if (topErrors.size() < MAX_TOP_ERRORS) {
                topErrors.add(detail);
            }
            return this;
        }

        public LoadStatistics build() {
            return new LoadStatistics(
                rowsRead,
                rowsAccepted,
                rowsSkipped,
                Map.copyOf(errorCounts),
                List.copyOf(topErrors)
            );
        }
    }
}
