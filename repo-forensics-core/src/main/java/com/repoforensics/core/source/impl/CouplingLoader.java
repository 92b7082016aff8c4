package com.repoforensics.core.source.impl;

import com.repoforensics.core.model.CouplingRecord;
import com.repoforensics.core.model.Signal;
import com.repoforensics.core.model.SourceRecord;
import com.repoforensics.core.source.LoadContext;
import com.repoforensics.core.source.base.AbstractCsvSourceLoader;
import com.repoforensics.core.source.base.CsvRow;
import com.repoforensics.core.source.base.MalformedRecordException;

import java.util.List;
import java.util.Set;

/**
 * Loads per-file sum of coupling ({@code entity,soc}).
 */
public class CouplingLoader extends AbstractCsvSourceLoader {

    @Override
    public String getId() {
        return "soc";
    }

    @Override
    public String getDisplayName() {
        return "Sum of Coupling";
    }

    @Override
    public String getDefaultFileName() {
        return "{repo}_code-analysis_soc.csv";
    }

    @Override
    public Set<Signal> getAffectedSignals() {
        return Set.of(Signal.COUPLING);
    }

    @Override
    public int getPriority() {
        return 30;
    }

    @Override
    protected List<String> getRequiredColumns() {
        return List.of("entity", "soc");
    }

    @Override
    protected SourceRecord parseRow(CsvRow row, LoadContext context) throws MalformedRecordException {
        return new CouplingRecord(row.requiredText("entity"), row.intValue("soc"));
    }
}
