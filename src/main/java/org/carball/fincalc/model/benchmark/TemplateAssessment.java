package org.carball.fincalc.model.benchmark;

public record TemplateAssessment(
    String templateId,
    TemplateMetric metric,
    double value,
    TemplateHealthStatus status,
    String message,
    TemplateBand band
) {}
