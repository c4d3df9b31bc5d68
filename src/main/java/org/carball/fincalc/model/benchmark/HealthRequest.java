package org.carball.fincalc.model.benchmark;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.EnumMap;
import java.util.Map;

/**
 * Business figures to score against an industry, keyed by metric field name
 * (for example {@code grossMarginPercent}).
 */
@Value
@Builder
@Jacksonized
public class HealthRequest {
    String industry;

    @Singular
    Map<String, Double> metrics;

    public Map<BenchmarkMetric, Double> typedMetrics() {
        Map<BenchmarkMetric, Double> typed = new EnumMap<>(BenchmarkMetric.class);
        metrics.forEach((name, value) -> typed.put(BenchmarkMetric.fromFieldName(name), value));
        return typed;
    }
}
