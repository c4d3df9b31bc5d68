package org.carball.fincalc.model.sensitivity;

import org.carball.fincalc.model.scenario.StandardMetricsResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One row of points per variable, ordered like {@code variations}.
 */
public record SensitivityMatrix(
    StandardMetricsResult baseline,
    List<Double> variations,
    Map<SensitivityVariable, List<SensitivityPoint>> rows
) {

    public List<SensitivityPoint> row(SensitivityVariable variable) {
        return rows.getOrDefault(variable, List.of());
    }

    public Optional<SensitivityPoint> point(SensitivityVariable variable, double variationPercent) {
        return row(variable).stream()
                .filter(p -> Double.compare(p.variationPercent(), variationPercent) == 0)
                .findFirst();
    }

    public double baselineValue(SensitivityMetric metric) {
        return metric == SensitivityMetric.NPV ? baseline.npv() : baseline.roi();
    }
}
