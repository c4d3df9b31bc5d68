package org.carball.fincalc.model.benchmark;

import java.util.List;

/**
 * Weighted business health on a 0-100 scale. Only weighted metrics appear in the breakdown.
 */
public record HealthScore(
    String industry,
    int overallScore,
    HealthCategory category,
    List<HealthBreakdown> breakdown
) {}
