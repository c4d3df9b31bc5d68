package org.carball.fincalc.model.scenario;

/**
 * Differences are {@code adjusted - base}.
 */
public record ScenarioComparison(
    StandardMetricsResult base,
    StandardMetricsResult adjusted,
    double roiDifference,
    double npvDifference,
    double paybackDifference,
    double irrDifference
) {}
