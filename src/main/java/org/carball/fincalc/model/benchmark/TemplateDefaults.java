package org.carball.fincalc.model.benchmark;

/**
 * Starting values a template suggests for break-even and pricing work.
 */
public record TemplateDefaults(
    double fixedCosts,
    double pricePerUnit,
    double variableCostPerUnit,
    double desiredMargin
) {}
