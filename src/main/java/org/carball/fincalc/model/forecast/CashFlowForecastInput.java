package org.carball.fincalc.model.forecast;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Inputs for a month-by-month cash projection. Growth rates are monthly percentages.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CashFlowForecastInput {
    double startingCash;
    double monthlyRevenue;
    double monthlyExpenses;

    @Builder.Default
    double revenueGrowthRate = 0;

    @Builder.Default
    double expenseGrowthRate = 0;

    // Indexed by calendar position (month - 1) mod 12; missing entries count as 1.0
    @Singular
    List<Double> seasonalFactors;

    @Singular
    List<MonthlyAmount> oneTimeExpenses;

    @Singular
    List<MonthlyAmount> expectedReceivables;

    // null falls back to the configured default horizon
    Integer forecastMonths;
}
