package org.carball.fincalc.model.saas;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Unit economics and one month of MRR movement. Rates and margins are percentages;
 * ARPU and churn are monthly.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SaasInput {
    double averageRevenuePerUser;
    double churnRate;
    double cacCost;
    double grossMargin;

    double startingMrr;
    double expansionMrr;
    double churnedMrr;
    double contractedMrr;

    double revenueGrowthRate;
    double profitMargin;
}
