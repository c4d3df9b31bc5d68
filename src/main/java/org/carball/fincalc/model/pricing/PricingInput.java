package org.carball.fincalc.model.pricing;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Unit cost and margin target for one product or service.
 * Competitor price, volume and fixed costs are optional.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PricingInput {
    double costPerUnit;

    // Percent of the selling price kept as gross profit, 0-99
    double desiredMargin;

    Double competitorPrice;
    Double targetVolume;
    Double fixedCostsPerPeriod;
}
