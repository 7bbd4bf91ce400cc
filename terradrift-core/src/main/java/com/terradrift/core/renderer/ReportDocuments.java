package com.terradrift.core.renderer;

import com.terradrift.core.model.DriftRecord;
import com.terradrift.core.model.DriftReport;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the document shape shared by the structured renderers.
 *
 * <pre>{@code
 * resource_id: i-0123
 * drift_found: true
 * drift_count: 1
 * generated_at: 2024-05-01T10:15:30Z
 * drifts:
 *   instance_type:
 *     status: VALUE_MISMATCH
 *     in_live: true
 *     in_declared: true
 *     live_value: t2.micro
 *     declared_value: t2.small
 * }</pre>
 *
 * Values absent on a side are omitted rather than written as null.
 */
public final class ReportDocuments {

    private ReportDocuments() {
        // Utility class
    }

    public static Map<String, Object> toDocument(DriftReport report) {
        Map<String, Object> drifts = new LinkedHashMap<>();
        report.records().forEach((attribute, record) -> drifts.put(attribute, toDocument(record)));

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("resource_id", report.resourceId());
        document.put("drift_found", report.hasDrift());
        document.put("drift_count", report.driftCount());
        document.put("generated_at", report.generatedAt().toString());
        document.put("drifts", drifts);
        return document;
    }

    private static Map<String, Object> toDocument(DriftRecord record) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("status", record.status().name());
        document.put("in_live", record.presentInLive());
        document.put("in_declared", record.presentInDeclared());
        record.live().ifPresent(value -> document.put("live_value", value.toPlainObject()));
        record.declared().ifPresent(value -> document.put("declared_value", value.toPlainObject()));
        return document;
    }
}
