package org.carball.fincalc.model.composite;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Sprint effort split and cost figures. Maintenance hours may not exceed total dev hours.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TechDebtInputs {
    double maintenanceHoursPerSprint;
    double totalDevHoursPerSprint;
    double teamAnnualCost;
    double incidentCostPerMonth;
}
