package com.terradrift.core.renderer.impl;

import com.terradrift.core.model.ConfigValue;
import com.terradrift.core.model.DriftRecord;
import com.terradrift.core.model.DriftReport;
import com.terradrift.core.renderer.ReportRenderer;

import java.util.Map;

/**
 * Human-readable report, one block per resource.
 *
 * <pre>
 * Drift report for i-0123 (generated 2024-05-01T10:15:30Z)
 *   2 drifted attribute(s):
 *   - instance_type [VALUE_MISMATCH]
 *       live:     "t2.micro"
 *       declared: "t2.small"
 *   - tags.Owner [ONLY_IN_LIVE]
 *       live:     "ops"
 * </pre>
 */
public class TextReportRenderer implements ReportRenderer {

    private static final String NEWLINE = "\n";

    @Override
    public String getId() {
        return "text";
    }

    @Override
    public String render(DriftReport report) {
        StringBuilder out = new StringBuilder();
        out.append("Drift report for ").append(report.resourceId())
            .append(" (generated ").append(report.generatedAt()).append(')').append(NEWLINE);

        if (!report.hasDrift()) {
            out.append("  No drift detected").append(NEWLINE);
            return out.toString();
        }

        out.append("  ").append(report.driftCount()).append(" drifted attribute(s):").append(NEWLINE);
        for (Map.Entry<String, DriftRecord> entry : report.records().entrySet()) {
            DriftRecord record = entry.getValue();
            out.append("  - ").append(entry.getKey())
                .append(" [").append(record.status().name()).append(']').append(NEWLINE);
            record.live().ifPresent(value -> appendValue(out, "live:    ", value));
            record.declared().ifPresent(value -> appendValue(out, "declared:", value));
        }
        return out.toString();
    }

    private static void appendValue(StringBuilder out, String label, ConfigValue value) {
        out.append("      ").append(label).append(' ').append(value.toDisplayString()).append(NEWLINE);
    }
}
