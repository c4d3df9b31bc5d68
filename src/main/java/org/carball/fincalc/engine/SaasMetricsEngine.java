package org.carball.fincalc.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.fincalc.model.composite.IndexRating;
import org.carball.fincalc.model.saas.SaasInput;
import org.carball.fincalc.model.saas.SaasMetric;
import org.carball.fincalc.model.saas.SaasMetrics;
import org.carball.fincalc.validation.InputValidator;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static org.carball.fincalc.validation.NumericGuards.roundCurrency;

/**
 * Subscription unit economics: lifetime value, CAC payback, net revenue retention and the rule of 40.
 */
@Slf4j
public class SaasMetricsEngine {

    public SaasMetrics calculate(SaasInput input) {
        InputValidator.validate(input);

        double monthlyGrossProfit = input.getAverageRevenuePerUser() * input.getGrossMargin() / 100;
        double churn = input.getChurnRate() / 100;

        Double ltv = churn > 0 ? roundCurrency(monthlyGrossProfit / churn) : null;
        Double ltvCacRatio = ltv != null ? roundCurrency(ltv / input.getCacCost()) : null;
        Double paybackMonths = monthlyGrossProfit > 0
                ? roundCurrency(input.getCacCost() / monthlyGrossProfit)
                : null;

        double endingMrr = input.getStartingMrr() + input.getExpansionMrr()
                - input.getChurnedMrr() - input.getContractedMrr();
        double netRevenueRetention = roundCurrency(endingMrr / input.getStartingMrr() * 100);
        double ruleOf40 = roundCurrency(input.getRevenueGrowthRate() + input.getProfitMargin());

        Map<SaasMetric, IndexRating> ratings = new EnumMap<>(SaasMetric.class);
        if (ltvCacRatio != null) {
            ratings.put(SaasMetric.LTV_CAC_RATIO, SaasMetric.LTV_CAC_RATIO.rate(ltvCacRatio));
        }
        if (paybackMonths != null) {
            ratings.put(SaasMetric.PAYBACK_MONTHS, SaasMetric.PAYBACK_MONTHS.rate(paybackMonths));
        }
        ratings.put(SaasMetric.NET_REVENUE_RETENTION, SaasMetric.NET_REVENUE_RETENTION.rate(netRevenueRetention));
        ratings.put(SaasMetric.RULE_OF_40, SaasMetric.RULE_OF_40.rate(ruleOf40));

        log.debug("LTV: {}", ltv);
        log.debug("LTV/CAC: {}", ltvCacRatio);
        log.debug("CAC payback (months): {}", paybackMonths);
        log.debug("NRR (%): {}", netRevenueRetention);
        log.debug("Rule of 40: {}", ruleOf40);

        return new SaasMetrics(ltv, input.getCacCost(), ltvCacRatio, paybackMonths,
                netRevenueRetention, ruleOf40, Collections.unmodifiableMap(ratings));
    }
}
