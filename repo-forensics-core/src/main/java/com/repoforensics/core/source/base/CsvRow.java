package com.repoforensics.core.source.base;

import java.util.Map;

/**
 * One data row of a CSV source with header-based column access.
 *
 * @param header column name to index
 * @param values row values
 * @param rowNumber 1-based data row number
 */
public record CsvRow(Map<String, Integer> header, String[] values, int rowNumber) {

    /**
     * Returns the raw text of a column, trimmed.
     *
     * @param column column name
     * @return value, or null if the column is absent or empty
     */
    public String text(String column) {
        Integer index = header.get(column);
        if (index == null || index >= values.length || values[index] == null) {
            return null;
        }
        String value = values[index].trim();
        return value.isEmpty() ? null : value;
    }

    /**
     * Returns the text of a required column.
     *
     * @param column column name
     * @return non-empty value
     * @throws MalformedRecordException if the value is missing
     */
    public String requiredText(String column) throws MalformedRecordException {
        String value = text(column);
        if (value == null) {
            throw new MalformedRecordException("missing value", "missing value for '" + column + "'");
        }
        return value;
    }

    /**
     * Parses a required integer column.
     *
     * @param column column name
     * @return parsed value
     * @throws MalformedRecordException if the value is missing or not an integer
     */
    public int intValue(String column) throws MalformedRecordException {
        String value = requiredText(column);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new MalformedRecordException("invalid number", "'" + column + "' is not an integer: " + value);
        }
    }

    /**
     * Parses a required decimal column.
     *
     * @param column column name
     * @return parsed value
     * @throws MalformedRecordException if the value is missing or not a finite number
     */
    public double doubleValue(String column) throws MalformedRecordException {
        String value = requiredText(column);
        try {
            double parsed = Double.parseDouble(value);
            if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
                throw new MalformedRecordException("invalid number", "'" + column + "' is not finite: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new MalformedRecordException("invalid number", "'" + column + "' is not a number: " + value);
        }
    }

    /**
     * Returns the row joined with commas, for log messages.
     *
     * @return raw row text
     */
    public String raw() {
        return String.join(",", values);
    }
}
