package org.carball.fincalc.model.benchmark;

import lombok.Getter;

/**
 * Metrics tracked for every industry. Cost and day-count metrics are lower-is-better.
 * A health weight of 0 means the metric does not contribute to the health score.
 */
@Getter
public enum BenchmarkMetric {

    GROSS_MARGIN_PERCENT("grossMarginPercent", MetricDirection.HIGHER_IS_BETTER, 25),
    NET_MARGIN_PERCENT("netMarginPercent", MetricDirection.HIGHER_IS_BETTER, 20),
    OPERATING_MARGIN_PERCENT("operatingMarginPercent", MetricDirection.HIGHER_IS_BETTER, 0),
    LABOR_COST_PERCENT("laborCostPercent", MetricDirection.LOWER_IS_BETTER, 15),
    RENT_COST_PERCENT("rentCostPercent", MetricDirection.LOWER_IS_BETTER, 0),
    INVENTORY_TURNOVER("inventoryTurnover", MetricDirection.HIGHER_IS_BETTER, 10),
    CURRENT_RATIO("currentRatio", MetricDirection.HIGHER_IS_BETTER, 15),
    DAYS_RECEIVABLE("daysReceivable", MetricDirection.LOWER_IS_BETTER, 0),
    DAYS_PAYABLE("daysPayable", MetricDirection.LOWER_IS_BETTER, 0),
    REVENUE_GROWTH_PERCENT("revenueGrowthPercent", MetricDirection.HIGHER_IS_BETTER, 15);

    private final String fieldName;
    private final MetricDirection direction;
    private final int healthWeight;

    BenchmarkMetric(String fieldName, MetricDirection direction, int healthWeight) {
        this.fieldName = fieldName;
        this.direction = direction;
        this.healthWeight = healthWeight;
    }

    public boolean isHigherBetter() {
        return direction == MetricDirection.HIGHER_IS_BETTER;
    }

    public static BenchmarkMetric fromFieldName(String name) {
        for (BenchmarkMetric metric : values()) {
            if (metric.fieldName.equals(name) || metric.name().equalsIgnoreCase(name)) {
                return metric;
            }
        }
        throw new IllegalArgumentException("Unknown benchmark metric: " + name);
    }
}
