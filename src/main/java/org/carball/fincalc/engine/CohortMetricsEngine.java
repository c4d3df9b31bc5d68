package org.carball.fincalc.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.fincalc.model.cohort.CohortBenchmark;
import org.carball.fincalc.model.cohort.CohortInput;
import org.carball.fincalc.model.cohort.CohortMetrics;
import org.carball.fincalc.validation.InputValidator;

import java.util.ArrayList;
import java.util.List;

import static org.carball.fincalc.validation.NumericGuards.roundCurrency;
import static org.carball.fincalc.validation.NumericGuards.safeDivide;

/**
 * Profitability of one customer cohort after direct, acquisition and servicing costs.
 */
@Slf4j
public class CohortMetricsEngine {

    public CohortMetrics calculate(CohortInput input) {
        InputValidator.validate(input);

        double totalMargin = input.getCohortRevenue() - input.getDirectCosts();
        double contributionMargin = roundCurrency(totalMargin / input.getCohortRevenue() * 100);
        double marginPerCustomer = roundCurrency(totalMargin / input.getCustomerCount());

        // No servicing cost leaves the index undefined; it reports 0
        double profitabilityIndex = roundCurrency(safeDivide(
                marginPerCustomer - input.getAcquisitionCost(), input.getServicingCostPerCustomer()));

        boolean losingMoney = contributionMargin < CohortBenchmark.CONTRIBUTION_MARGIN.getCritical();

        log.debug("Contribution margin for cohort {} (%): {}", input.getCohortName(), contributionMargin);
        log.debug("Margin per customer: {}", marginPerCustomer);
        log.debug("Profitability index: {}", profitabilityIndex);
        if (losingMoney) {
            log.warn("Cohort {} is losing money at a {}% contribution margin", input.getCohortName(), contributionMargin);
        }

        return new CohortMetrics(
                input.getCohortName(),
                contributionMargin,
                marginPerCustomer,
                profitabilityIndex,
                losingMoney,
                CohortBenchmark.CONTRIBUTION_MARGIN.rate(contributionMargin),
                CohortBenchmark.PROFITABILITY_INDEX.rate(profitabilityIndex),
                recommendations(contributionMargin, profitabilityIndex));
    }

    static List<String> recommendations(double contributionMargin, double profitabilityIndex) {
        List<String> recommendations = new ArrayList<>();

        if (contributionMargin < CohortBenchmark.CONTRIBUTION_MARGIN.getCritical()) {
            recommendations.add("CRITICAL: This cohort is losing money. Restructure pricing or stop serving it.");
            recommendations.add("Find the cost components driving the loss and look for reductions.");
        } else if (contributionMargin < CohortBenchmark.CONTRIBUTION_MARGIN.getAcceptable()) {
            recommendations.add("Contribution margin is below the 20% industry average. Review pricing for this segment.");
            recommendations.add("Consider upselling higher-margin products to this cohort.");
        } else if (contributionMargin >= CohortBenchmark.CONTRIBUTION_MARGIN.getOptimal()) {
            recommendations.add("High-value cohort. Consider investing in acquisition for this segment.");
            recommendations.add("Find what makes this cohort profitable and apply it to other segments.");
        }

        if (profitabilityIndex < CohortBenchmark.PROFITABILITY_INDEX.getCritical()) {
            recommendations.add("Acquisition costs exceed the contribution per customer. Reduce CAC or raise customer value.");
        } else if (profitabilityIndex < CohortBenchmark.PROFITABILITY_INDEX.getAcceptable()) {
            recommendations.add("Marginal profitability. Focus on retention to extend customer lifetime value.");
        }
        return List.copyOf(recommendations);
    }
}
