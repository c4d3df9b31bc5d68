package org.carball.fincalc.model.benchmark;

/**
 * Percentile band for one industry metric.
 */
public record BenchmarkRange(double p25, double median, double p75, double optimal) {}
