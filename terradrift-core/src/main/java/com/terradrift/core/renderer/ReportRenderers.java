package com.terradrift.core.renderer;

import com.terradrift.core.error.ConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;

/**
 * Looks up {@link ReportRenderer} implementations registered through {@link ServiceLoader}.
 */
public final class ReportRenderers {

    private ReportRenderers() {
        // Utility class
    }

    /**
     * Returns all registered renderers in registration order.
     *
     * @return renderers
     */
    public static List<ReportRenderer> available() {
        List<ReportRenderer> renderers = new ArrayList<>();
        ServiceLoader.load(ReportRenderer.class).forEach(renderers::add);
        return renderers;
    }

    /**
     * Finds the renderer for an output format, ignoring case.
     *
     * @param format format name, e.g. "json"
     * @return matching renderer
     * @throws ConfigurationException if no renderer has that id
     */
    public static ReportRenderer forFormat(String format) {
        String wanted = format == null ? "" : format.trim().toLowerCase(Locale.ROOT);
        List<ReportRenderer> renderers = available();
        return renderers.stream()
            .filter(renderer -> renderer.getId().equals(wanted))
            .findFirst()
            .orElseThrow(() -> new ConfigurationException(
                "Unknown output format '" + format + "'. Available: "
                    + renderers.stream().map(ReportRenderer::getId).toList()));
    }
}
