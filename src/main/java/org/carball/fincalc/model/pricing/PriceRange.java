package org.carball.fincalc.model.pricing;

public record PriceRange(
    double low,
    double high
) {}
