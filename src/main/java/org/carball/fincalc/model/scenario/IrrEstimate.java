package org.carball.fincalc.model.scenario;

/**
 * Result of the Newton-Raphson IRR search.
 *
 * @param monthlyRate     last monthly rate held by the solver
 * @param annualPercent   {@code ((1 + monthlyRate)^12 - 1) * 100}
 * @param iterations      Newton steps taken before termination
 * @param status          termination reason
 */
public record IrrEstimate(
    double monthlyRate,
    double annualPercent,
    int iterations,
    IrrStatus status
) {}
