package org.carball.fincalc.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.fincalc.model.pricing.CompetitorComparison;
import org.carball.fincalc.model.pricing.PricePosition;
import org.carball.fincalc.model.pricing.PriceRange;
import org.carball.fincalc.model.pricing.PriceStrategies;
import org.carball.fincalc.model.pricing.PricingInput;
import org.carball.fincalc.model.pricing.PricingResult;
import org.carball.fincalc.validation.InputValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.carball.fincalc.validation.NumericGuards.roundCurrency;

/**
 * Prices a unit from its cost and a gross margin target, nudged toward the competitor price.
 */
@Slf4j
public class PricingEngine {

    private static final double COMPETITOR_WEIGHT = 0.3;
    private static final double MINIMUM_MARKUP = 1.1;
    private static final double PREMIUM_FACTOR = 1.15;
    private static final double PENETRATION_FACTOR = 0.85;
    private static final double RANGE_LOW_FACTOR = 0.9;
    private static final double RANGE_HIGH_FACTOR = 1.15;

    // Price gaps within this many currency units count as level with the competitor
    private static final double SAME_PRICE_TOLERANCE = 0.5;

    private static final double LOW_MARGIN_PERCENT = 20;
    private static final double HIGH_MARGIN_PERCENT = 60;

    public PricingResult calculate(PricingInput input) {
        InputValidator.validate(input);

        double cost = input.getCostPerUnit();
        double targetMarginPrice = cost / (1 - input.getDesiredMargin() / 100);
        double markup = (targetMarginPrice - cost) / cost * 100;
        double grossProfit = targetMarginPrice - cost;

        Double breakEvenPrice = null;
        if (input.getTargetVolume() != null && input.getFixedCostsPerPeriod() != null) {
            breakEvenPrice = roundCurrency(cost + input.getFixedCostsPerPeriod() / input.getTargetVolume());
        }

        CompetitorComparison comparison = null;
        if (input.getCompetitorPrice() != null) {
            comparison = compareToCompetitor(targetMarginPrice, input.getCompetitorPrice());
        }

        double recommended = recommendedPrice(targetMarginPrice, input.getCompetitorPrice(), cost);
        PriceRange range = new PriceRange(
                roundCurrency(Math.max(cost * MINIMUM_MARKUP, recommended * RANGE_LOW_FACTOR)),
                roundCurrency(recommended * RANGE_HIGH_FACTOR));
        PriceStrategies strategies = new PriceStrategies(
                roundCurrency(targetMarginPrice * PREMIUM_FACTOR),
                roundCurrency(input.getCompetitorPrice() != null ? input.getCompetitorPrice() : targetMarginPrice),
                roundCurrency(targetMarginPrice * PENETRATION_FACTOR));

        log.debug("Target margin price: {}", targetMarginPrice);
        log.debug("Recommended price: {}", recommended);

        return new PricingResult(
                roundCurrency(cost),
                roundCurrency(targetMarginPrice),
                roundCurrency(markup),
                roundCurrency(grossProfit),
                breakEvenPrice,
                comparison,
                recommended,
                range,
                strategies,
                recommendations(input.getDesiredMargin(), comparison, range, grossProfit));
    }

    /**
     * 70% target price and 30% competitor price, never below 110% of unit cost.
     */
    static double recommendedPrice(double targetMarginPrice, Double competitorPrice, double minimumPrice) {
        double price = targetMarginPrice;
        if (competitorPrice != null) {
            price = targetMarginPrice * (1 - COMPETITOR_WEIGHT) + competitorPrice * COMPETITOR_WEIGHT;
        }
        return roundCurrency(Math.max(price, minimumPrice * MINIMUM_MARKUP));
    }

    static CompetitorComparison compareToCompetitor(double targetMarginPrice, double competitorPrice) {
        double difference = targetMarginPrice - competitorPrice;
        PricePosition position;
        if (difference > SAME_PRICE_TOLERANCE) {
            position = PricePosition.ABOVE;
        } else if (difference < -SAME_PRICE_TOLERANCE) {
            position = PricePosition.BELOW;
        } else {
            position = PricePosition.SAME;
        }
        return new CompetitorComparison(
                roundCurrency(difference),
                roundCurrency(difference / competitorPrice * 100),
                position);
    }

    private static List<String> recommendations(double desiredMargin, CompetitorComparison comparison,
                                                PriceRange range, double grossProfit) {
        List<String> recommendations = new ArrayList<>();

        if (desiredMargin < LOW_MARGIN_PERCENT) {
            recommendations.add("Low margin target (< 20%). Check that it is sustainable long-term.");
        } else if (desiredMargin > HIGH_MARGIN_PERCENT) {
            recommendations.add("High margin target (> 60%). Make sure the value proposition justifies premium pricing.");
        }

        if (comparison != null && comparison.position() != PricePosition.SAME) {
            boolean above = comparison.position() == PricePosition.ABOVE;
            recommendations.add(String.format(Locale.ROOT, "Your price is %.1f%% %s competitors.",
                    Math.abs(comparison.percentageDiff()), above ? "above" : "below"));
            recommendations.add(above
                    ? "Make sure your product or service has clear differentiators."
                    : "You may have room to increase prices.");
        }

        recommendations.add(String.format(Locale.ROOT, "Recommended price range: %.2f - %.2f", range.low(), range.high()));
        recommendations.add(String.format(Locale.ROOT, "At the target margin price you earn %.2f per unit.", grossProfit));
        return List.copyOf(recommendations);
    }
}
