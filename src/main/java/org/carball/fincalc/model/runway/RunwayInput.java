package org.carball.fincalc.model.runway;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class RunwayInput {
    double currentCash;
    double monthlyBurnRate;
    Double plannedFundraising;

    // Percent of customers lost per month
    @Builder.Default
    double monthlyChurnRate = 0;

    public double totalCash() {
        return currentCash + (plannedFundraising == null ? 0 : plannedFundraising);
    }
}
