package com.repoforensics.core.report;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads developer ranking reports written by the JSON report generator.
 */
public class RankingReportReader {

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Reads a ranking report file.
     *
     * @param file JSON report
     * @return parsed document
     * @throws IOException if the file cannot be read or is not a ranking report
     */
    public RankingDocument read(Path file) throws IOException {
        return objectMapper.readValue(file.toFile(), RankingDocument.class);
    }

    /**
     * Parses ranking report content.
     *
     * @param json JSON content
     * @return parsed document
     * @throws IOException if the content is not a ranking report
     */
    public RankingDocument parse(String json) throws IOException {
        return objectMapper.readValue(json, RankingDocument.class);
    }
}
