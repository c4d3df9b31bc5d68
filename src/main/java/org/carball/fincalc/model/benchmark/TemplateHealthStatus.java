package org.carball.fincalc.model.benchmark;

public enum TemplateHealthStatus {
    HEALTHY,
    WARNING,
    CRITICAL
}
