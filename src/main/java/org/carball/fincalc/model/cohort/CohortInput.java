package org.carball.fincalc.model.cohort;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Revenue and cost of one customer segment over the same period.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CohortInput {
    String cohortName;
    double cohortRevenue;
    double directCosts;
    double customerCount;
    double acquisitionCost;
    double servicingCostPerCustomer;
}
