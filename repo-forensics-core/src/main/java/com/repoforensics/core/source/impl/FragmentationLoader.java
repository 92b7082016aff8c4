package com.repoforensics.core.source.impl;

import com.repoforensics.core.model.FragmentationRecord;
import com.repoforensics.core.model.Signal;
import com.repoforensics.core.model.SourceRecord;
import com.repoforensics.core.source.LoadContext;
import com.repoforensics.core.source.base.AbstractCsvSourceLoader;
import com.repoforensics.core.source.base.CsvRow;
import com.repoforensics.core.source.base.MalformedRecordException;

import java.util.List;
import java.util.Set;

/**
 * Loads per-file fractal values ({@code entity,fractal-value,total-revs}).
 */
public class FragmentationLoader extends AbstractCsvSourceLoader {

    @Override
    public String getId() {
        return "fragmentation";
    }

    @Override
    public String getDisplayName() {
        return "Fragmentation";
    }

    @Override
    public String getDefaultFileName() {
        return "{repo}_code-analysis_fragmentation.csv";
    }

    @Override
    public Set<Signal> getAffectedSignals() {
        return Set.of(Signal.FRAGMENTATION);
    }

    @Override
    public int getPriority() {
        return 40;
    }

    @Override
    protected List<String> getRequiredColumns() {
        return List.of("entity", "fractal-value");
    }

    @Override
    protected SourceRecord parseRow(CsvRow row, LoadContext context) throws MalformedRecordException {
        return new FragmentationRecord(row.requiredText("entity"), row.doubleValue("fractal-value"));
    }
}
