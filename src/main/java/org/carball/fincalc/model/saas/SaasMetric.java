package org.carball.fincalc.model.saas;

import lombok.Getter;
import org.carball.fincalc.model.benchmark.MetricDirection;
import org.carball.fincalc.model.composite.IndexRating;

/**
 * SaaS health metrics with their benchmark bands.
 */
@Getter
public enum SaasMetric {

    LTV_CAC_RATIO("LTV/CAC", MetricDirection.HIGHER_IS_BETTER, 5.0, 3.0, 3.5),
    PAYBACK_MONTHS("CAC payback (months)", MetricDirection.LOWER_IS_BETTER, 12, 18, 15),
    NET_REVENUE_RETENTION("Net revenue retention (%)", MetricDirection.HIGHER_IS_BETTER, 120, 100, 110),
    RULE_OF_40("Rule of 40", MetricDirection.HIGHER_IS_BETTER, 50, 40, 40);

    private final String displayName;
    private final MetricDirection direction;
    private final double optimal;
    private final double acceptable;
    private final double industryAverage;

    SaasMetric(String displayName, MetricDirection direction,
               double optimal, double acceptable, double industryAverage) {
        this.displayName = displayName;
        this.direction = direction;
        this.optimal = optimal;
        this.acceptable = acceptable;
        this.industryAverage = industryAverage;
    }

    /**
     * Higher-is-better metrics reach a band at its threshold; payback must be under 12
     * months to be optimal and at most 18 to be acceptable.
     */
    public IndexRating rate(double value) {
        if (direction == MetricDirection.HIGHER_IS_BETTER) {
            if (value >= optimal) return IndexRating.OPTIMAL;
            if (value >= acceptable) return IndexRating.ACCEPTABLE;
            return IndexRating.CONCERNING;
        }
        if (value < optimal) return IndexRating.OPTIMAL;
        if (value <= acceptable) return IndexRating.ACCEPTABLE;
        return IndexRating.CONCERNING;
    }
}
