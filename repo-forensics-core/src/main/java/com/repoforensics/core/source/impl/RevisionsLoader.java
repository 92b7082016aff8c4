package com.repoforensics.core.source.impl;

import com.repoforensics.core.model.RevisionRecord;
import com.repoforensics.core.model.Signal;
import com.repoforensics.core.model.SourceRecord;
import com.repoforensics.core.source.LoadContext;
import com.repoforensics.core.source.base.AbstractCsvSourceLoader;
import com.repoforensics.core.source.base.CsvRow;
import com.repoforensics.core.source.base.MalformedRecordException;

import java.util.List;
import java.util.Set;

/**
 * Loads per-file revision counts ({@code entity,n-revs}).
 *
 * <p>Revision paths seed the known file set, so this loader runs first.
 */
public class RevisionsLoader extends AbstractCsvSourceLoader {

    @Override
    public String getId() {
        return "revisions";
    }

    @Override
    public String getDisplayName() {
        return "Revision Counts";
    }

    @Override
    public String getDefaultFileName() {
        return "{repo}_code-analysis_revisions.csv";
    }

    @Override
    public Set<Signal> getAffectedSignals() {
        return Set.of(Signal.HOTSPOT_WORK, Signal.HOTSPOT_COMMITS);
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    protected List<String> getRequiredColumns() {
        return List.of("entity", "n-revs");
    }

    @Override
    protected SourceRecord parseRow(CsvRow row, LoadContext context) throws MalformedRecordException {
        int revisions = row.intValue("n-revs");
        if (revisions < 0) {
            throw new MalformedRecordException("invalid number", "negative revision count: " + revisions);
        }
        return new RevisionRecord(row.requiredText("entity"), revisions);
    }
}
