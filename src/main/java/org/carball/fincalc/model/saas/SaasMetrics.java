package org.carball.fincalc.model.saas;

import org.carball.fincalc.model.composite.IndexRating;

import java.util.Map;

/**
 * @param ltv           gross profit per user over the expected lifetime, {@code null} at zero churn
 * @param ltvCacRatio   {@code null} when {@code ltv} is
 * @param paybackMonths months of gross profit to recover CAC, {@code null} at zero gross margin
 * @param ratings       one entry per metric that has a value
 */
public record SaasMetrics(
    Double ltv,
    double cac,
    Double ltvCacRatio,
    Double paybackMonths,
    double netRevenueRetention,
    double ruleOf40,
    Map<SaasMetric, IndexRating> ratings
) {}
