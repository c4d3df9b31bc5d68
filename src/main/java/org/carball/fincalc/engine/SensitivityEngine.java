package org.carball.fincalc.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.fincalc.config.EngineSettings;
import org.carball.fincalc.model.scenario.ScenarioInput;
import org.carball.fincalc.model.scenario.StandardMetricsResult;
import org.carball.fincalc.model.sensitivity.ImpactLevel;
import org.carball.fincalc.model.sensitivity.SensitivityAnalysis;
import org.carball.fincalc.model.sensitivity.SensitivityMatrix;
import org.carball.fincalc.model.sensitivity.SensitivityMetric;
import org.carball.fincalc.model.sensitivity.SensitivityPoint;
import org.carball.fincalc.model.sensitivity.SensitivityVariable;
import org.carball.fincalc.model.sensitivity.TornadoEntry;
import org.carball.fincalc.validation.InputValidator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.carball.fincalc.validation.NumericGuards.requireGreaterThan;
import static org.carball.fincalc.validation.NumericGuards.requirePresent;
import static org.carball.fincalc.validation.NumericGuards.roundCurrency;
import static org.carball.fincalc.validation.NumericGuards.safeDivide;

/**
 * One-at-a-time sensitivity analysis over the scenario inputs.
 */
@Slf4j
public class SensitivityEngine {

    private static final double HIGH_IMPACT_SHARE = 0.7;
    private static final double MEDIUM_IMPACT_SHARE = 0.4;
    private static final double HIGH_RISK_SHARE = 0.5;
    private static final double MEDIUM_RISK_SHARE = 0.25;
    private static final double MIN_VARIATION_PERCENT = -100;

    private final StandardMetricsEngine metricsEngine;
    private final EngineSettings settings;

    public SensitivityEngine() {
        this(EngineSettings.defaults());
    }

    public SensitivityEngine(EngineSettings settings) {
        this(new StandardMetricsEngine(settings), settings);
    }

    public SensitivityEngine(StandardMetricsEngine metricsEngine, EngineSettings settings) {
        this.metricsEngine = metricsEngine;
        this.settings = settings;
    }

    /**
     * Default sweep plus the NPV tornado built from it.
     */
    public SensitivityAnalysis analyze(ScenarioInput base) {
        SensitivityMatrix matrix = sweep(base);
        return new SensitivityAnalysis(matrix, tornado(matrix, SensitivityMetric.NPV));
    }

    /**
     * Sweeps every default variable over the configured variations.
     */
    public SensitivityMatrix sweep(ScenarioInput base) {
        return sweep(base, SensitivityVariable.defaults(), settings.getSensitivityVariations());
    }

    /**
     * Recomputes NPV and ROI with one variable scaled by {@code 1 + v / 100} at a time.
     */
    public SensitivityMatrix sweep(ScenarioInput base, List<SensitivityVariable> variables, List<Double> variations) {
        InputValidator.validate(base);
        if (variables == null || variables.isEmpty()) {
            throw new IllegalArgumentException("At least one sensitivity variable is required");
        }
        if (variations == null || variations.isEmpty()) {
            throw new IllegalArgumentException("At least one sensitivity variation is required");
        }
        // A variation of -100% or below would zero or flip the scaled field
        for (Double variation : variations) {
            requireGreaterThan(requirePresent(variation, "variations"), MIN_VARIATION_PERCENT, "variations");
        }

        StandardMetricsResult baseline = metricsEngine.calculate(base);
        Map<SensitivityVariable, List<SensitivityPoint>> rows = new LinkedHashMap<>();

        for (SensitivityVariable variable : variables) {
            List<SensitivityPoint> row = new ArrayList<>(variations.size());
            for (double variation : variations) {
                StandardMetricsResult result = variation == 0
                        ? baseline
                        : metricsEngine.calculate(variable.scale(base, 1 + variation / 100));
                row.add(new SensitivityPoint(variable, variation, result.npv(), result.roi()));
            }
            rows.put(variable, List.copyOf(row));
        }

        log.info("Sensitivity sweep: {} variables x {} variations around NPV {}",
                variables.size(), variations.size(), baseline.npv());
        return new SensitivityMatrix(baseline, List.copyOf(variations), Collections.unmodifiableMap(rows));
    }

    /**
     * Builds tornado bars from the most negative and most positive variation of each row,
     * widest bar first. Ties keep the sweep order.
     */
    public List<TornadoEntry> tornado(SensitivityMatrix matrix, SensitivityMetric metric) {
        double baselineValue = matrix.baselineValue(metric);
        double baselineNpv = matrix.baseline().npv();

        List<Bar> bars = new ArrayList<>();
        double maxRange = 0;

        for (Map.Entry<SensitivityVariable, List<SensitivityPoint>> row : matrix.rows().entrySet()) {
            SensitivityPoint low = null;
            SensitivityPoint high = null;
            for (SensitivityPoint point : row.getValue()) {
                if (point.variationPercent() < 0 && (low == null || point.variationPercent() < low.variationPercent())) {
                    low = point;
                }
                if (point.variationPercent() > 0 && (high == null || point.variationPercent() > high.variationPercent())) {
                    high = point;
                }
            }

            Bar bar = new Bar(row.getKey(),
                    low == null ? 0 : low.variationPercent(),
                    high == null ? 0 : high.variationPercent(),
                    low == null ? 0 : metric.valueOf(low) - baselineValue,
                    high == null ? 0 : metric.valueOf(high) - baselineValue);
            maxRange = Math.max(maxRange, bar.range());
            bars.add(bar);
        }

        List<TornadoEntry> entries = new ArrayList<>(bars.size());
        for (Bar bar : bars) {
            entries.add(new TornadoEntry(bar.variable(),
                    bar.negativeVariation(),
                    bar.positiveVariation(),
                    roundCurrency(bar.negativeImpact()),
                    roundCurrency(bar.positiveImpact()),
                    roundCurrency(bar.range()),
                    impactLevel(bar.range(), maxRange),
                    riskLevel(bar.negativeImpact(), baselineNpv)));
        }

        entries.sort(Comparator.comparingDouble(TornadoEntry::range).reversed());
        return List.copyOf(entries);
    }

    static ImpactLevel impactLevel(double range, double maxRange) {
        double share = safeDivide(range, maxRange);
        if (share > HIGH_IMPACT_SHARE) {
            return ImpactLevel.HIGH;
        } else if (share > MEDIUM_IMPACT_SHARE) {
            return ImpactLevel.MEDIUM;
        }
        return ImpactLevel.LOW;
    }

    // A zero baseline makes any downside maximal
    static ImpactLevel riskLevel(double negativeImpact, double baselineNpv) {
        double downside = Math.abs(negativeImpact);
        double share = safeDivide(downside, Math.abs(baselineNpv), downside > 0 ? 1.0 : 0.0);
        if (share > HIGH_RISK_SHARE) {
            return ImpactLevel.HIGH;
        } else if (share > MEDIUM_RISK_SHARE) {
            return ImpactLevel.MEDIUM;
        }
        return ImpactLevel.LOW;
    }

    private record Bar(SensitivityVariable variable, double negativeVariation, double positiveVariation,
                       double negativeImpact, double positiveImpact) {
        double range() {
            return Math.abs(positiveImpact - negativeImpact);
        }
    }
}
