package org.carball.fincalc.model.breakeven;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class BreakEvenInput {
    double fixedCosts;
    double pricePerUnit;
    double variableCostPerUnit;

    // Sales over the same period as fixedCosts; enables margin of safety
    Double currentSalesUnits;

    @Builder.Default
    int periodMonths = 12;
}
