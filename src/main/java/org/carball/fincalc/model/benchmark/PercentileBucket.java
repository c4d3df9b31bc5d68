package org.carball.fincalc.model.benchmark;

import lombok.Getter;

@Getter
public enum PercentileBucket {

    TOP_25("Your %s is in the TOP 25%% of the industry!"),
    ABOVE_MEDIAN("Your %s is above the industry median."),
    BELOW_MEDIAN("Your %s is below the industry median."),
    BOTTOM_25("Your %s is in the BOTTOM 25%% of the industry.");

    private final String messageTemplate;

    PercentileBucket(String messageTemplate) {
        this.messageTemplate = messageTemplate;
    }

    public String describe(BenchmarkMetric metric) {
        return String.format(messageTemplate, metric.getFieldName());
    }
}
