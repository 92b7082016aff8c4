package com.repoforensics.core.source.base;

import com.repoforensics.core.model.SourceRecord;
import com.repoforensics.core.source.LoadResult;
import com.repoforensics.core.source.LoadStatistics;
import org.slf4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects decoded records and skipped rows for one load operation.
 */
public class RecordCollector {

    private final String loaderId;
    private final Logger log;
    private final List<SourceRecord> records = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final LoadStatistics.Builder statistics = new LoadStatistics.Builder();

    RecordCollector(String loaderId, Logger log) {
        this.loaderId = loaderId;
        this.log = log;
    }

    /**
     * Counts one data row as read.
     */
    public void rowRead() {
        statistics.incrementRowsRead();
    }

    /**
     * Adds a decoded record.
     *
     * @param record decoded record
     */
    public void accept(SourceRecord record) {
        records.add(record);
        statistics.incrementRowsAccepted();
    }

    /**
     * Records a skipped row and logs it.
     *
     * @param location row location, e.g. "row 12"
     * @param raw raw row content
     * @param e decoding error
     */
    public void skip(String location, String raw, MalformedRecordException e) {
        String message = String.format("%s %s skipped (%s): %s", loaderId, location, e.getMessage(), raw);
        log.warn("Skipping malformed record in {} at {}: {} [{}]", loaderId, location, e.getMessage(), raw);
        warnings.add(message);
        statistics.addSkip(e.getReason(), message);
    }

    /**
     * Returns the number of records accepted so far.
     *
     * @return accepted record count
     */
    public int size() {
        return records.size();
    }

    LoadResult toResult(Path sourceFile) {
        return LoadResult.loaded(loaderId, sourceFile, records, warnings, statistics.build());
    }
}
