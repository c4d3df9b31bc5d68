package org.carball.fincalc.model.composite;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class FrictionInputs {
    double manualHoursPerWeek;
    double hourlyCost;
    double currentRevenue;
}
