package org.carball.fincalc.model.marketing;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Results of one campaign. Impressions and clicks are optional.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MarketingInput {
    double totalSpend;
    double conversions;
    double revenuePerConversion;

    @Builder.Default
    MarketingChannel channel = MarketingChannel.OTHER;

    Double impressions;
    Double clicks;
}
