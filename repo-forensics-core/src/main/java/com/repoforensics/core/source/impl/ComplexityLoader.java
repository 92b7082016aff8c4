package com.repoforensics.core.source.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.repoforensics.core.model.ComplexityRecord;
import com.repoforensics.core.model.Signal;
import com.repoforensics.core.model.SourceRecord;
import com.repoforensics.core.source.LoadContext;
import com.repoforensics.core.source.base.AbstractJsonSourceLoader;
import com.repoforensics.core.source.base.MalformedRecordException;
import com.repoforensics.core.util.FileUtils;

import java.util.Set;

/**
 * Loads per-function complexity measurements.
 *
 * <p>Reads {@code analysis.functions[]} (or a top-level {@code functions[]}) with fields
 * {@code file}, {@code cyclomatic_complexity} and {@code nloc} ({@code lines_of_code} is
 * accepted as well). Paths are made relative to the configured repository root.
 */
public class ComplexityLoader extends AbstractJsonSourceLoader {

    @Override
    public String getId() {
        return "complexity";
    }

    @Override
    public String getDisplayName() {
        return "Function Complexity";
    }

    @Override
    public String getDefaultFileName() {
        return "complexity.json";
    }

    @Override
    public Set<Signal> getAffectedSignals() {
        return Set.of(Signal.COMPLEXITY, Signal.HOTSPOT_WORK, Signal.HOTSPOT_COMMITS);
    }

    @Override
    public int getPriority() {
        return 20;
    }

    @Override
    protected JsonNode selectRecords(JsonNode root) {
        JsonNode functions = root.path("analysis").path("functions");
        if (functions.isArray()) {
            return functions;
        }
        return root.path("functions");
    }

    @Override
    protected SourceRecord parseRecord(JsonNode node, LoadContext context) throws MalformedRecordException {
        String file = extractText(node, "file");
        if (file == null) {
            throw new MalformedRecordException("missing value", "missing value for 'file'");
        }
        int complexity = requiredInt(node, "cyclomatic_complexity");
        int linesOfCode = node.hasNonNull("nloc")
            ? requiredInt(node, "nloc")
            : optionalInt(node, "lines_of_code", 0);

        String relative = FileUtils.stripPrefix(FileUtils.toForwardSlashes(file), context.repositoryRoot());
        return new ComplexityRecord(relative, extractText(node, "function_name"), complexity, linesOfCode);
    }
}
