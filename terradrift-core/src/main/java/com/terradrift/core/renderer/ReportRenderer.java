package com.terradrift.core.renderer;

import com.terradrift.core.model.DriftReport;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns drift reports into printable output.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI); see
 * {@link ReportRenderers}. Output must be deterministic: equal reports render to equal text.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.terradrift.core.renderer.ReportRenderer}
 */
public interface ReportRenderer {

    /**
     * Returns the output format name, lowercase (e.g. "text", "json").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders one report.
     *
     * @param report drift report
     * @return rendered text, ending with a newline
     */
    String render(DriftReport report);

    /**
     * Renders several reports as one output. Defaults to concatenating single renders.
     *
     * @param reports drift reports in display order
     * @return rendered text
     */
    default String renderAll(List<DriftReport> reports) {
        return reports.stream().map(this::render).collect(Collectors.joining());
    }
}
