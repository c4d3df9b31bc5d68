package org.carball.fincalc.model.employee;

import java.util.List;

/**
 * @param totalCost         salary, benefits and onboarding for the first year
 * @param productivityRatio revenue per hour over recurring cost per hour
 * @param paybackMonths     months of net contribution to recover onboarding, {@code null} when contribution is not positive
 */
public record EmployeeRoiResult(
    double totalCost,
    double roiPercentage,
    double netContribution,
    double revenuePerDollarSpent,
    double costPerHour,
    double revenuePerHour,
    double breakEvenRevenue,
    double productivityRatio,
    boolean worthHiring,
    Double paybackMonths,
    CostEfficiency costEfficiency,
    ProductivityLevel productivityLevel,
    List<String> recommendations
) {}
