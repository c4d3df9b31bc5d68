package org.carball.fincalc.model.pricing;

/**
 * @param difference     target margin price minus competitor price
 * @param percentageDiff difference as a percent of the competitor price
 */
public record CompetitorComparison(
    double difference,
    double percentageDiff,
    PricePosition position
) {}
