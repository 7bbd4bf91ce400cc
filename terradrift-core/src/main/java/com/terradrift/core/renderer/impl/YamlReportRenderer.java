package com.terradrift.core.renderer.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.terradrift.core.model.DriftReport;
import com.terradrift.core.renderer.ReportDocuments;
import com.terradrift.core.renderer.ReportRenderer;

import java.io.UncheckedIOException;

/**
 * YAML, one document per report. Each document starts with {@code ---}, so several reports
 * concatenate into a valid multi-document stream. Strings stay quoted so {@code "8"} and
 * {@code 8} remain distinguishable.
 */
public class YamlReportRenderer implements ReportRenderer {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    @Override
    public String getId() {
        return "yaml";
    }

    @Override
    public String render(DriftReport report) {
        try {
            return YAML_MAPPER.writeValueAsString(ReportDocuments.toDocument(report));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize drift report", e);
        }
    }
}
