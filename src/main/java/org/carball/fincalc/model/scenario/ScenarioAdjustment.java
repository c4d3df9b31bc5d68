package org.carball.fincalc.model.scenario;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * What-if adjustment applied on top of a base scenario.
 * Sales and costs are percentage changes, discount is in absolute rate points.
 */
@Value
@Builder
@Jacksonized
public class ScenarioAdjustment {
    double salesPercent;
    double costsPercent;
    double discountPoints;
}
