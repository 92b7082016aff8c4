package com.repoforensics.core.source.impl;

import com.repoforensics.core.model.CommunicationRecord;
import com.repoforensics.core.model.Signal;
import com.repoforensics.core.model.SourceRecord;
import com.repoforensics.core.source.LoadContext;
import com.repoforensics.core.source.base.AbstractCsvSourceLoader;
import com.repoforensics.core.source.base.CsvRow;
import com.repoforensics.core.source.base.MalformedRecordException;

import java.util.List;
import java.util.Set;

/**
 * Loads author-to-peer collaboration ({@code author,peer,shared,average,strength}).
 */
public class CommunicationLoader extends AbstractCsvSourceLoader {

    @Override
    public String getId() {
        return "communication";
    }

    @Override
    public String getDisplayName() {
        return "Communication";
    }

    @Override
    public String getDefaultFileName() {
        return "{repo}_code-analysis_communication.csv";
    }

    @Override
    public Set<Signal> getAffectedSignals() {
        return Set.of(Signal.COMMUNICATION);
    }

    @Override
    public int getPriority() {
        return 80;
    }

    @Override
    protected List<String> getRequiredColumns() {
        return List.of("author", "peer", "shared", "strength");
    }

    @Override
    protected SourceRecord parseRow(CsvRow row, LoadContext context) throws MalformedRecordException {
        return new CommunicationRecord(
            row.requiredText("author"),
            row.requiredText("peer"),
            row.intValue("shared"),
            row.intValue("strength")
        );
    }
}
