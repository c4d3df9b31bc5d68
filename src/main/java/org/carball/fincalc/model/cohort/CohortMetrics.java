package org.carball.fincalc.model.cohort;

import org.carball.fincalc.model.composite.IndexRating;

import java.util.List;

/**
 * @param contributionMargin percent of cohort revenue left after direct costs
 * @param profitabilityIndex margin per customer net of acquisition cost, in units of servicing cost
 */
public record CohortMetrics(
    String cohortName,
    double contributionMargin,
    double marginPerCustomer,
    double profitabilityIndex,
    boolean losingMoney,
    IndexRating marginRating,
    IndexRating profitabilityRating,
    List<String> recommendations
) {}
