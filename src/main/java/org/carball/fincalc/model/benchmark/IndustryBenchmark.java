package org.carball.fincalc.model.benchmark;

import java.util.List;
import java.util.Map;

public record IndustryBenchmark(
    String industry,
    String displayName,
    Map<BenchmarkMetric, BenchmarkRange> metrics,
    List<Kpi> kpis
) {

    public BenchmarkRange range(BenchmarkMetric metric) {
        BenchmarkRange range = metrics.get(metric);
        if (range == null) {
            throw new IllegalArgumentException("No " + metric.getFieldName() + " benchmark for industry: " + industry);
        }
        return range;
    }
}
