package org.carball.fincalc.model.employee;

/**
 * Salary band that keeps a hire at or above a target ROI, rounded to whole currency units.
 */
public record SalaryRange(
    double maxTotalCost,
    double minSalary,
    double maxSalary,
    double assumedBenefitsRatio
) {}
