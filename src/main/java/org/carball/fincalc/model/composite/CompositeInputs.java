package org.carball.fincalc.model.composite;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Operational inputs for the proprietary indices. Each group is optional and
 * only the indices whose group is present are computed.
 */
@Value
@Builder
@Jacksonized
public class CompositeInputs {
    FrictionInputs friction;
    TechDebtInputs techDebt;
    EfficiencyInputs efficiency;
}
