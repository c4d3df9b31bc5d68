package org.carball.fincalc.model.benchmark;

import lombok.Getter;

@Getter
public enum TemplateMetric {

    GROSS_MARGIN("grossMargin", "Gross margin", MetricDirection.HIGHER_IS_BETTER),
    NET_MARGIN("netMargin", "Net margin", MetricDirection.HIGHER_IS_BETTER),
    LABOR_COST_RATIO("laborCostRatio", "Labor cost", MetricDirection.LOWER_IS_BETTER);

    private final String fieldName;
    private final String displayName;
    private final MetricDirection direction;

    TemplateMetric(String fieldName, String displayName, MetricDirection direction) {
        this.fieldName = fieldName;
        this.displayName = displayName;
        this.direction = direction;
    }

    public static TemplateMetric fromFieldName(String name) {
        for (TemplateMetric metric : values()) {
            if (metric.fieldName.equals(name) || metric.name().equalsIgnoreCase(name)) {
                return metric;
            }
        }
        throw new IllegalArgumentException("Unknown template metric: " + name);
    }
}
