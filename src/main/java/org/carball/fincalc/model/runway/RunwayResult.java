package org.carball.fincalc.model.runway;

import java.time.LocalDate;

public record RunwayResult(
    double runwayMonths,
    LocalDate zeroCashDate,
    double churnImpact6Months,
    RunwayStatus status
) {}
