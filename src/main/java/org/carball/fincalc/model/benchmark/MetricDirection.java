package org.carball.fincalc.model.benchmark;

public enum MetricDirection {
    HIGHER_IS_BETTER,
    LOWER_IS_BETTER
}
