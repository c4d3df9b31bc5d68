package org.carball.fincalc.model.marketing;

import java.util.List;

/**
 * Campaign return figures. Click metrics are {@code null} without clicks, and the
 * cost per acquisition is {@code null} for a campaign with no conversions.
 *
 * @param roas                 revenue per unit of spend
 * @param lifetimeValueToCac   three first purchases against the cost per acquisition
 * @param breakEvenConversions conversions needed for revenue to cover spend
 */
public record MarketingRoiResult(
    double roiPercentage,
    double roas,
    double totalRevenue,
    double netProfit,
    Double costPerAcquisition,
    Double costPerClick,
    Double clickThroughRate,
    Double conversionRate,
    Double revenuePerClick,
    double lifetimeValueToCac,
    ChannelEfficiency channelEfficiency,
    BenchmarkVerdict cacVsBenchmark,
    BenchmarkVerdict conversionVsBenchmark,
    boolean profitable,
    long breakEvenConversions,
    List<String> recommendations
) {

    public MarketingRoiResult withRecommendations(List<String> recommendations) {
        return new MarketingRoiResult(roiPercentage, roas, totalRevenue, netProfit, costPerAcquisition,
                costPerClick, clickThroughRate, conversionRate, revenuePerClick, lifetimeValueToCac,
                channelEfficiency, cacVsBenchmark, conversionVsBenchmark, profitable, breakEvenConversions,
                List.copyOf(recommendations));
    }
}
