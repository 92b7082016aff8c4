package com.repoforensics.core.source.base;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.repoforensics.core.model.SourceRecord;
import com.repoforensics.core.source.LoadContext;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Abstract base class for loaders that read CSV files with a header row using Jackson.
 *
 * <p>Rows are read as plain string arrays so that one bad row never aborts the file. The
 * header row is matched case-insensitively; rows whose column count differs from the header
 * are skipped as malformed. A row the CSV parser cannot tokenize (an unclosed quote, for
 * example) is skipped and ends the read, keeping every record accepted before it.
 *
 * @see AbstractSourceLoader
 */
public abstract class AbstractCsvSourceLoader extends AbstractSourceLoader {

    /**
     * CSV mapper reading each row as a {@code String[]}.
     * Thread-safe and reusable across parse operations.
     */
    protected final CsvMapper csvMapper;

    /**
     * Constructor that initializes the CSV mapper.
     */
    protected AbstractCsvSourceLoader() {
        super();
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
    }

    /**
     * Returns the columns that must appear in the header.
     *
     * @return required column names (lowercase)
     */
    protected abstract List<String> getRequiredColumns();

    /**
     * Decodes one data row.
     *
     * @param row the row
     * @param context load context
     * @return decoded record
     * @throws MalformedRecordException if the row cannot be decoded
     */
    protected abstract SourceRecord parseRow(CsvRow row, LoadContext context) throws MalformedRecordException;

    @Override
    protected void decode(Path file, LoadContext context, RecordCollector collector) throws IOException {
        try (MappingIterator<String[]> rows = csvMapper.readerFor(String[].class)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .readValues(file.toFile())) {

            if (!rows.hasNextValue()) {
                log.warn("{} is empty: {}", getDisplayName(), file);
                return;
            }

            Map<String, Integer> header = parseHeader(rows.nextValue());
            List<String> missing = getRequiredColumns().stream()
                .filter(column -> !header.containsKey(column))
                .toList();
            if (!missing.isEmpty()) {
                throw new IOException("Missing required columns " + missing + " in " + file.getFileName());
            }

            int rowNumber = 0;
            while (true) {
                String[] values;
                try {
                    if (!rows.hasNextValue()) {
                        break;
                    }
                    values = rows.nextValue();
                } catch (JsonProcessingException e) {
                    rowNumber++;
                    collector.rowRead();
                    collector.skip("row " + rowNumber, "",
                        new MalformedRecordException("unparseable row", e.getOriginalMessage()));
                    log.warn("Stopped reading {} at row {}; the rest of the file cannot be parsed", file, rowNumber);
                    break;
                }
                rowNumber++;
                collector.rowRead();
                CsvRow row = new CsvRow(header, values, rowNumber);
                try {
                    if (values.length != header.size()) {
                        throw new MalformedRecordException("column count mismatch",
                            "expected " + header.size() + " columns but found " + values.length);
                    }
                    collector.accept(parseRow(row, context));
                } catch (MalformedRecordException e) {
                    collector.skip("row " + rowNumber, row.raw(), e);
                } catch (IllegalArgumentException e) {
                    collector.skip("row " + rowNumber, row.raw(), new MalformedRecordException("invalid value", e.getMessage()));
                }
            }
        }
    }

    private Map<String, Integer> parseHeader(String[] columns) {
        Map<String, Integer> header = new HashMap<>();
        for (int i = 0; i < columns.length; i++) {
            String name = columns[i] == null ? "" : columns[i].trim().toLowerCase();
            // strip a UTF-8 byte order mark from the first column
            if (i == 0 && name.startsWith("\uFEFF")) {
                name = name.substring(1);
            }
            header.putIfAbsent(name, i);
        }
        return header;
    }
}
