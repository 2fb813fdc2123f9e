package com.entitygraph.core.report.impl;

import com.entitygraph.core.model.DriftResult;
import com.entitygraph.core.model.IntegrityReport;
import com.entitygraph.core.model.RepairResult;
import com.entitygraph.core.report.ReportFormatter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Pretty printed JSON output, suitable for piping into other tools.
 */
public class JsonReportFormatter implements ReportFormatter {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String format(IntegrityReport report) {
        return write(report);
    }

    @Override
    public String format(DriftResult drift) {
        return write(drift);
    }

    @Override
    public String format(RepairResult result) {
        return write(result);
    }

    private static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
