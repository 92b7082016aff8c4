package com.repoforensics.core.source.impl;

import com.repoforensics.core.model.MainDeveloperRecord;
import com.repoforensics.core.model.Signal;
import com.repoforensics.core.model.SourceRecord;
import com.repoforensics.core.source.LoadContext;
import com.repoforensics.core.source.base.AbstractCsvSourceLoader;
import com.repoforensics.core.source.base.CsvRow;
import com.repoforensics.core.source.base.MalformedRecordException;

import java.util.List;
import java.util.Set;

/**
 * Loads the main developer per file ({@code entity,main-dev,added,total-added,ownership}).
 */
public class MainDeveloperLoader extends AbstractCsvSourceLoader {

    @Override
    public String getId() {
        return "main-dev";
    }

    @Override
    public String getDisplayName() {
        return "Main Developers";
    }

    @Override
    public String getDefaultFileName() {
        return "{repo}_code-analysis_main_dev.csv";
    }

    @Override
    public Set<Signal> getAffectedSignals() {
        return Set.of(Signal.OWNERSHIP);
    }

    @Override
    public int getPriority() {
        return 70;
    }

    @Override
    protected List<String> getRequiredColumns() {
        return List.of("entity", "main-dev", "ownership");
    }

    @Override
    protected SourceRecord parseRow(CsvRow row, LoadContext context) throws MalformedRecordException {
        double ownership = row.doubleValue("ownership");
        if (ownership < 0.0 || ownership > 1.0) {
            throw new MalformedRecordException("out of range", "ownership outside [0, 1]: " + ownership);
        }
        return new MainDeveloperRecord(row.requiredText("entity"), row.requiredText("main-dev"), ownership);
    }
}
