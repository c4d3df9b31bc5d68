package org.carball.fincalc.model.benchmark;

import java.util.List;

public record HealthReport(HealthScore score, List<BenchmarkComparison> comparisons) {}
