package org.carball.fincalc.model.marketing;

import java.util.List;

/**
 * @param results campaigns in input order
 */
public record ChannelComparison(
    List<ChannelResult> results,
    MarketingChannel bestChannel,
    MarketingChannel worstChannel,
    List<String> recommendations
) {}
