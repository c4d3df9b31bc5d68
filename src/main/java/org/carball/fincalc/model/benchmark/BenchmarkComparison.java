package org.carball.fincalc.model.benchmark;

/**
 * @param vsMedian  percent difference from the median, 1 dp
 * @param vsOptimal percent difference from the optimal value, 1 dp
 */
public record BenchmarkComparison(
    String industry,
    BenchmarkMetric metric,
    double value,
    PercentileBucket bucket,
    double vsMedian,
    double vsOptimal,
    String message,
    BenchmarkRange range
) {}
