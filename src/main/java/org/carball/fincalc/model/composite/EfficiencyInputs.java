package org.carball.fincalc.model.composite;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Two consecutive periods of revenue and burn rate.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class EfficiencyInputs {
    double currentRevenue;
    double previousRevenue;
    double currentBurnRate;
    double previousBurnRate;
}
