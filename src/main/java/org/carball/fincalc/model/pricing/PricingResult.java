package org.carball.fincalc.model.pricing;

import java.util.List;

/**
 * @param breakEvenPrice       unit cost plus fixed cost per unit, {@code null} without volume and fixed costs
 * @param competitorComparison {@code null} without a competitor price
 */
public record PricingResult(
    double minimumPrice,
    double targetMarginPrice,
    double markupPercentage,
    double grossProfitPerUnit,
    Double breakEvenPrice,
    CompetitorComparison competitorComparison,
    double recommendedPrice,
    PriceRange recommendedPriceRange,
    PriceStrategies priceStrategies,
    List<String> recommendations
) {}
