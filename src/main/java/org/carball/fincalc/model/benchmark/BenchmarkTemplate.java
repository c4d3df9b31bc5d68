package org.carball.fincalc.model.benchmark;

import java.util.Map;

public record BenchmarkTemplate(
    String id,
    String name,
    String industry,
    String description,
    TemplateDefaults defaultInputs,
    Map<TemplateMetric, TemplateBand> bands
) {

    public TemplateBand band(TemplateMetric metric) {
        TemplateBand band = bands.get(metric);
        if (band == null) {
            throw new IllegalArgumentException("Template " + id + " has no band for " + metric.getFieldName());
        }
        return band;
    }
}
