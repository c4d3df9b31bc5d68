package org.carball.fincalc.model.breakeven;

/**
 * @param contributionMarginRatio percent of price left after variable cost
 * @param marginOfSafety          percent of current sales above break-even, {@code null} without current sales
 */
public record BreakEvenResult(
    long breakEvenUnits,
    double breakEvenRevenue,
    double contributionMarginPerUnit,
    double contributionMarginRatio,
    Double marginOfSafety,
    Long marginOfSafetyUnits,
    boolean aboveBreakEven,
    long unitsPerMonth,
    double revenuePerMonth
) {}
