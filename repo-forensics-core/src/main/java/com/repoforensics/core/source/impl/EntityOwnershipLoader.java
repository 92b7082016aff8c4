package com.repoforensics.core.source.impl;

import com.repoforensics.core.model.OwnershipRecord;
import com.repoforensics.core.model.Signal;
import com.repoforensics.core.model.SourceRecord;
import com.repoforensics.core.source.LoadContext;
import com.repoforensics.core.source.base.AbstractCsvSourceLoader;
import com.repoforensics.core.source.base.CsvRow;
import com.repoforensics.core.source.base.MalformedRecordException;

import java.util.List;
import java.util.Set;

/**
 * Loads lines added and deleted per author and file ({@code entity,author,added,deleted}).
 *
 * <p>Every churn-based signal is derived from these rows.
 */
public class EntityOwnershipLoader extends AbstractCsvSourceLoader {

    @Override
    public String getId() {
        return "entity-ownership";
    }

    @Override
    public String getDisplayName() {
        return "Entity Ownership";
    }

    @Override
    public String getDefaultFileName() {
        return "{repo}_code-analysis_entity_ownership.csv";
    }

    @Override
    public Set<Signal> getAffectedSignals() {
        return Set.of(Signal.CHURN, Signal.HOTSPOT_WORK, Signal.HOTSPOT_COMMITS, Signal.COMPLEXITY,
            Signal.FRAGMENTATION, Signal.COUPLING);
    }

    @Override
    public int getPriority() {
        return 60;
    }

    @Override
    protected List<String> getRequiredColumns() {
        return List.of("entity", "author", "added", "deleted");
    }

    @Override
    protected SourceRecord parseRow(CsvRow row, LoadContext context) throws MalformedRecordException {
        int added = row.intValue("added");
        int deleted = row.intValue("deleted");
        if (added < 0 || deleted < 0) {
            throw new MalformedRecordException("invalid number", "negative line count");
        }
        return new OwnershipRecord(row.requiredText("entity"), row.requiredText("author"), added, deleted);
    }
}
