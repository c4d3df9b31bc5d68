package org.carball.fincalc.model.benchmark;

public record HealthBreakdown(BenchmarkMetric metric, double value, int score, int weight) {}
