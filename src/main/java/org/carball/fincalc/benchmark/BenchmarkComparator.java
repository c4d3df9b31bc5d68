package org.carball.fincalc.benchmark;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.carball.fincalc.model.benchmark.BenchmarkComparison;
import org.carball.fincalc.model.benchmark.BenchmarkMetric;
import org.carball.fincalc.model.benchmark.BenchmarkRange;
import org.carball.fincalc.model.benchmark.HealthBreakdown;
import org.carball.fincalc.model.benchmark.HealthCategory;
import org.carball.fincalc.model.benchmark.HealthReport;
import org.carball.fincalc.model.benchmark.HealthScore;
import org.carball.fincalc.model.benchmark.IndustryBenchmark;
import org.carball.fincalc.model.benchmark.MetricDirection;
import org.carball.fincalc.model.benchmark.PercentileBucket;
import org.carball.fincalc.model.benchmark.TemplateAssessment;
import org.carball.fincalc.model.benchmark.TemplateBand;
import org.carball.fincalc.model.benchmark.TemplateHealthStatus;
import org.carball.fincalc.model.benchmark.TemplateMetric;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.carball.fincalc.validation.NumericGuards.requireFinite;
import static org.carball.fincalc.validation.NumericGuards.round;
import static org.carball.fincalc.validation.NumericGuards.safeDivide;

/**
 * Places business figures against industry percentiles and template bands.
 */
@Slf4j
public class BenchmarkComparator {

    private static final int SCORE_OPTIMAL = 100;
    private static final int SCORE_TOP_QUARTILE = 85;
    private static final int SCORE_ABOVE_MEDIAN = 70;
    private static final int SCORE_BELOW_MEDIAN = 50;
    private static final int SCORE_BOTTOM_QUARTILE = 30;

    @Getter
    private final BenchmarkCatalog catalog;

    public BenchmarkComparator() {
        this(BenchmarkCatalog.loadDefault());
    }

    public BenchmarkComparator(BenchmarkCatalog catalog) {
        this.catalog = catalog;
    }

    public static PercentileBucket bucket(double value, BenchmarkRange range, MetricDirection direction) {
        if (direction == MetricDirection.HIGHER_IS_BETTER) {
            if (value >= range.p75()) {
                return PercentileBucket.TOP_25;
            } else if (value >= range.median()) {
                return PercentileBucket.ABOVE_MEDIAN;
            } else if (value >= range.p25()) {
                return PercentileBucket.BELOW_MEDIAN;
            }
            return PercentileBucket.BOTTOM_25;
        }

        if (value <= range.p25()) {
            return PercentileBucket.TOP_25;
        } else if (value <= range.median()) {
            return PercentileBucket.ABOVE_MEDIAN;
        } else if (value <= range.p75()) {
            return PercentileBucket.BELOW_MEDIAN;
        }
        return PercentileBucket.BOTTOM_25;
    }

    public BenchmarkComparison compare(String industry, BenchmarkMetric metric, double value) {
        requireFinite(value, metric.getFieldName());
        BenchmarkRange range = catalog.industry(industry).range(metric);

        PercentileBucket bucket = bucket(value, range, metric.getDirection());
        double vsMedian = round(safeDivide(value - range.median(), range.median()) * 100, 1);
        double vsOptimal = round(safeDivide(value - range.optimal(), range.optimal()) * 100, 1);

        log.debug("{} {} = {} -> {}", industry, metric.getFieldName(), value, bucket);
        return new BenchmarkComparison(industry, metric, value, bucket, vsMedian, vsOptimal,
                bucket.describe(metric), range);
    }

    /**
     * Weighted score over the supplied metrics. Metrics without a health weight are ignored;
     * no weighted metric at all gives a score of 0.
     */
    public HealthScore healthScore(String industry, Map<BenchmarkMetric, Double> values) {
        IndustryBenchmark benchmark = catalog.industry(industry);

        List<HealthBreakdown> breakdown = new ArrayList<>();
        int totalWeight = 0;
        double weightedScore = 0;

        for (BenchmarkMetric metric : BenchmarkMetric.values()) {
            Double value = values.get(metric);
            if (value == null || metric.getHealthWeight() == 0) {
                continue;
            }
            requireFinite(value, metric.getFieldName());

            int score = tierScore(value, benchmark.range(metric), metric.getDirection());
            breakdown.add(new HealthBreakdown(metric, value, score, metric.getHealthWeight()));
            totalWeight += metric.getHealthWeight();
            weightedScore += (double) score * metric.getHealthWeight();
        }

        int overall = totalWeight > 0 ? (int) Math.round(weightedScore / totalWeight) : 0;
        HealthCategory category = HealthCategory.fromScore(overall);

        log.info("Health score for {}: {} ({}) over {} metrics", industry, overall, category, breakdown.size());
        return new HealthScore(industry, overall, category, List.copyOf(breakdown));
    }

    /**
     * Health score plus a percentile comparison for every supplied metric.
     */
    public HealthReport report(String industry, Map<BenchmarkMetric, Double> values) {
        HealthScore score = healthScore(industry, values);
        List<BenchmarkComparison> comparisons = new ArrayList<>();
        for (BenchmarkMetric metric : BenchmarkMetric.values()) {
            Double value = values.get(metric);
            if (value != null) {
                comparisons.add(compare(industry, metric, value));
            }
        }
        return new HealthReport(score, List.copyOf(comparisons));
    }

    static int tierScore(double value, BenchmarkRange range, MetricDirection direction) {
        if (direction == MetricDirection.HIGHER_IS_BETTER) {
            if (value >= range.optimal()) {
                return SCORE_OPTIMAL;
            } else if (value >= range.p75()) {
                return SCORE_TOP_QUARTILE;
            } else if (value >= range.median()) {
                return SCORE_ABOVE_MEDIAN;
            } else if (value >= range.p25()) {
                return SCORE_BELOW_MEDIAN;
            }
            return SCORE_BOTTOM_QUARTILE;
        }

        if (value <= range.optimal()) {
            return SCORE_OPTIMAL;
        } else if (value <= range.p25()) {
            return SCORE_TOP_QUARTILE;
        } else if (value <= range.median()) {
            return SCORE_ABOVE_MEDIAN;
        } else if (value <= range.p75()) {
            return SCORE_BELOW_MEDIAN;
        }
        return SCORE_BOTTOM_QUARTILE;
    }

    /**
     * Checks a value against a template's min/optimal/max band.
     */
    public TemplateAssessment assess(String templateId, TemplateMetric metric, double value) {
        requireFinite(value, metric.getFieldName());
        TemplateBand band = catalog.template(templateId).band(metric);

        TemplateHealthStatus status;
        String message;
        if (metric.getDirection() == MetricDirection.LOWER_IS_BETTER) {
            if (value <= band.optimal()) {
                status = TemplateHealthStatus.HEALTHY;
                message = String.format("%s of %s%% is at or below optimal (%s%%)", metric.getDisplayName(), value, band.optimal());
            } else if (value <= band.max()) {
                status = TemplateHealthStatus.WARNING;
                message = String.format("%s of %s%% is above optimal but within range", metric.getDisplayName(), value);
            } else {
                status = TemplateHealthStatus.CRITICAL;
                message = String.format("%s of %s%% exceeds industry maximum (%s%%)", metric.getDisplayName(), value, band.max());
            }
        } else {
            if (value >= band.optimal()) {
                status = TemplateHealthStatus.HEALTHY;
                message = String.format("%s of %s%% meets or exceeds optimal (%s%%)", metric.getDisplayName(), value, band.optimal());
            } else if (value >= band.min()) {
                status = TemplateHealthStatus.WARNING;
                message = String.format("%s of %s%% is below optimal but acceptable", metric.getDisplayName(), value);
            } else {
                status = TemplateHealthStatus.CRITICAL;
                message = String.format("%s of %s%% is below industry minimum (%s%%)", metric.getDisplayName(), value, band.min());
            }
        }

        return new TemplateAssessment(templateId, metric, value, status, message, band);
    }
}
