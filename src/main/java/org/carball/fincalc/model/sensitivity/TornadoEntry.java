package org.carball.fincalc.model.sensitivity;

/**
 * Impacts are deltas from the baseline metric at the most negative and most
 * positive variation of the sweep.
 *
 * @param impactLevel range relative to the widest range in the chart
 * @param riskLevel   size of the downside relative to the baseline NPV
 */
public record TornadoEntry(
    SensitivityVariable variable,
    double negativeVariation,
    double positiveVariation,
    double negativeImpact,
    double positiveImpact,
    double range,
    ImpactLevel impactLevel,
    ImpactLevel riskLevel
) {}
