package org.carball.fincalc.model.scenario;

/**
 * Expected, best and worst case results for one set of assumptions.
 */
public record ScenarioSet(
    StandardMetricsResult expected,
    StandardMetricsResult best,
    StandardMetricsResult worst,
    double bestCaseMultiplier,
    double worstCaseMultiplier
) {}
