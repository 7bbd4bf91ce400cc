package com.terradrift.core.renderer.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.terradrift.core.model.DriftReport;
import com.terradrift.core.renderer.ReportDocuments;
import com.terradrift.core.renderer.ReportRenderer;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * Pretty-printed JSON. Several reports render as a JSON array.
 */
public class JsonReportRenderer implements ReportRenderer {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String render(DriftReport report) {
        return write(ReportDocuments.toDocument(report));
    }

    @Override
    public String renderAll(List<DriftReport> reports) {
        return write(reports.stream().map(ReportDocuments::toDocument).toList());
    }

    private static String write(Object document) {
        try {
            return JSON_MAPPER.writeValueAsString(document) + "\n";
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize drift report", e);
        }
    }
}
