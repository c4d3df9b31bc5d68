package org.carball.fincalc.model.marketing;

public record ChannelResult(
    MarketingChannel channel,
    double roiPercentage,
    double roas,
    Double costPerAcquisition
) {}
