package org.carball.fincalc.model.pricing;

public record PriceStrategies(
    double premium,
    double competitive,
    double penetration
) {}
