package org.carball.fincalc.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.fincalc.model.marketing.BenchmarkVerdict;
import org.carball.fincalc.model.marketing.ChannelComparison;
import org.carball.fincalc.model.marketing.ChannelEfficiency;
import org.carball.fincalc.model.marketing.ChannelResult;
import org.carball.fincalc.model.marketing.MarketingChannel;
import org.carball.fincalc.model.marketing.MarketingInput;
import org.carball.fincalc.model.marketing.MarketingRoiResult;
import org.carball.fincalc.validation.InputValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.carball.fincalc.validation.NumericGuards.roundCurrency;
import static org.carball.fincalc.validation.NumericGuards.safeDivide;

/**
 * Return on a marketing campaign, graded against the typical figures of its channel.
 */
@Slf4j
public class MarketingRoiEngine {

    // Lifetime value is estimated as three first purchases
    private static final double LIFETIME_PURCHASES = 3;

    public MarketingRoiResult calculate(MarketingInput input) {
        InputValidator.validate(input);

        double spend = input.getTotalSpend();
        double conversions = input.getConversions();
        MarketingChannel channel = input.getChannel();

        double totalRevenue = conversions * input.getRevenuePerConversion();
        double netProfit = totalRevenue - spend;
        double roi = netProfit / spend * 100;
        double roas = totalRevenue / spend;
        Double cac = conversions > 0 ? spend / conversions : null;

        Double costPerClick = null;
        Double conversionRate = null;
        Double revenuePerClick = null;
        Double clickThroughRate = null;
        Double clicks = input.getClicks();
        if (clicks != null && clicks > 0) {
            costPerClick = roundCurrency(spend / clicks);
            conversionRate = roundCurrency(conversions / clicks * 100);
            revenuePerClick = roundCurrency(totalRevenue / clicks);
        }
        if (clicks != null && input.getImpressions() != null && input.getImpressions() > 0) {
            clickThroughRate = roundCurrency(clicks / input.getImpressions() * 100);
        }

        long breakEvenConversions = (long) Math.ceil(spend / input.getRevenuePerConversion());
        double ltvToCac = cac == null ? 0 : safeDivide(input.getRevenuePerConversion() * LIFETIME_PURCHASES, cac);

        ChannelEfficiency efficiency = rateEfficiency(roi, cac, channel);
        BenchmarkVerdict cacVerdict = compareCac(cac, channel);
        BenchmarkVerdict conversionVerdict = compareConversionRate(conversionRate, channel);

        log.debug("Marketing ROI (%): {}", roi);
        log.debug("ROAS: {}", roas);
        log.debug("CAC: {}", cac);

        MarketingRoiResult result = new MarketingRoiResult(
                roundCurrency(roi),
                roundCurrency(roas),
                roundCurrency(totalRevenue),
                roundCurrency(netProfit),
                cac == null ? null : roundCurrency(cac),
                costPerClick,
                clickThroughRate,
                conversionRate,
                revenuePerClick,
                roundCurrency(ltvToCac),
                efficiency,
                cacVerdict,
                conversionVerdict,
                netProfit > 0,
                breakEvenConversions,
                List.of());
        return result.withRecommendations(recommendations(result, input));
    }

    /**
     * Ranks campaigns by ROI. Ties keep the earlier campaign as best and the later one as worst.
     */
    public ChannelComparison compareChannels(List<MarketingInput> campaigns) {
        if (campaigns == null || campaigns.isEmpty()) {
            throw new IllegalArgumentException("At least one campaign is required");
        }

        List<ChannelResult> results = new ArrayList<>(campaigns.size());
        ChannelResult best = null;
        ChannelResult worst = null;
        for (MarketingInput campaign : campaigns) {
            MarketingRoiResult roi = calculate(campaign);
            ChannelResult result = new ChannelResult(campaign.getChannel(),
                    roi.roiPercentage(), roi.roas(), roi.costPerAcquisition());
            results.add(result);

            if (best == null || result.roiPercentage() > best.roiPercentage()) {
                best = result;
            }
            if (worst == null || result.roiPercentage() <= worst.roiPercentage()) {
                worst = result;
            }
        }

        List<String> recommendations = new ArrayList<>();
        recommendations.add(String.format(Locale.ROOT, "Best performing channel: %s (%.1f%% ROI)", best.channel(), best.roiPercentage()));
        recommendations.add(String.format(Locale.ROOT, "Worst performing channel: %s (%.1f%% ROI)", worst.channel(), worst.roiPercentage()));
        if (best.roiPercentage() > 0 && worst.roiPercentage() < 0) {
            recommendations.add(String.format(Locale.ROOT, "Consider shifting budget from %s to %s.", worst.channel(), best.channel()));
        }

        log.info("Compared {} campaigns, best channel {} at {}% ROI", results.size(), best.channel(), best.roiPercentage());
        return new ChannelComparison(List.copyOf(results), best.channel(), worst.channel(), List.copyOf(recommendations));
    }

    static ChannelEfficiency rateEfficiency(double roi, Double cac, MarketingChannel channel) {
        double averageCac = channel.getAverageCac();
        if (cac != null && roi > 200 && cac < averageCac * 0.7) {
            return ChannelEfficiency.EXCELLENT;
        } else if (cac != null && roi > 100 && cac < averageCac) {
            return ChannelEfficiency.GOOD;
        } else if (roi > 0) {
            return ChannelEfficiency.AVERAGE;
        }
        return ChannelEfficiency.POOR;
    }

    // No conversions means no acquisitions at any cost
    static BenchmarkVerdict compareCac(Double cac, MarketingChannel channel) {
        if (cac == null) {
            return BenchmarkVerdict.WORSE;
        }
        double averageCac = channel.getAverageCac();
        if (cac < averageCac * 0.9) {
            return BenchmarkVerdict.BETTER;
        } else if (cac > averageCac * 1.1) {
            return BenchmarkVerdict.WORSE;
        }
        return BenchmarkVerdict.SAME;
    }

    static BenchmarkVerdict compareConversionRate(Double conversionRate, MarketingChannel channel) {
        if (conversionRate == null) {
            return BenchmarkVerdict.SAME;
        }
        double averageRate = channel.getAverageConversionRate();
        if (conversionRate > averageRate * 1.2) {
            return BenchmarkVerdict.BETTER;
        } else if (conversionRate < averageRate * 0.8) {
            return BenchmarkVerdict.WORSE;
        }
        return BenchmarkVerdict.SAME;
    }

    static List<String> recommendations(MarketingRoiResult r, MarketingInput input) {
        List<String> recommendations = new ArrayList<>();

        if (!r.profitable()) {
            recommendations.add(String.format(Locale.ROOT, "Campaign is losing money. Net loss: %.2f", Math.abs(r.netProfit())));
            double missing = r.breakEvenConversions() - input.getConversions();
            if (missing > 0) {
                recommendations.add(String.format(Locale.ROOT, "Need %.0f more conversions to break even.", Math.ceil(missing)));
            }
        } else {
            recommendations.add(String.format(Locale.ROOT, "Campaign is profitable. Net profit: %.2f", r.netProfit()));
        }

        if (r.roas() >= 4) {
            recommendations.add(String.format(Locale.ROOT, "Excellent ROAS of %.1fx. Consider increasing budget.", r.roas()));
        } else if (r.roas() >= 2) {
            recommendations.add(String.format(Locale.ROOT, "Good ROAS of %.1fx. Campaign is healthy.", r.roas()));
        } else if (r.roas() >= 1) {
            recommendations.add(String.format(Locale.ROOT, "ROAS of %.1fx is break-even territory. Optimize targeting.", r.roas()));
        }

        if (r.costPerAcquisition() != null && r.cacVsBenchmark() == BenchmarkVerdict.BETTER) {
            recommendations.add(String.format(Locale.ROOT, "CAC of %.2f is below the %s average.", r.costPerAcquisition(), input.getChannel()));
        } else if (r.costPerAcquisition() != null && r.cacVsBenchmark() == BenchmarkVerdict.WORSE) {
            recommendations.add(String.format(Locale.ROOT, "CAC of %.2f is above the %s average. Review targeting and creative.",
                    r.costPerAcquisition(), input.getChannel()));
        }

        if (r.clickThroughRate() != null && r.clickThroughRate() < 1) {
            recommendations.add("Low click-through rate. Test new ad creative and copy.");
        }
        if (r.conversionRate() != null && r.conversionRate() < 1) {
            recommendations.add("Low conversion rate. Review the landing page experience.");
        }

        if (r.costPerAcquisition() != null) {
            if (r.lifetimeValueToCac() >= 3) {
                recommendations.add(String.format(Locale.ROOT, "LTV/CAC of %.1fx supports sustainable acquisition.", r.lifetimeValueToCac()));
            } else if (r.lifetimeValueToCac() < 1.5) {
                recommendations.add(String.format(Locale.ROOT, "LTV/CAC of %.1fx is low. Reduce CAC or improve retention.", r.lifetimeValueToCac()));
            }
        }

        return List.copyOf(recommendations);
    }
}
