package org.carball.fincalc.model.scenario;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Assumptions for a single investment scenario.
 * Rates are annual percentages; durations are months.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ScenarioInput {
    double initialInvestment;
    double discountRate;
    int projectDuration;
    double yearlyRevenue;
    double revenueGrowth;
    double operatingCosts;
    double maintenanceCosts;

    // Applied to revenue only, used to derive best/worst cases
    @Builder.Default
    double multiplier = 1.0;

    public ScenarioInput withMultiplier(double scenarioMultiplier) {
        return toBuilder().multiplier(scenarioMultiplier).build();
    }
}
