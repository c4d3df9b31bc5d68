package org.carball.fincalc.model.employee;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * First-year cost and expected revenue of one hire.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class EmployeeInput {
    double annualSalary;
    double annualBenefits;
    double onboardingCosts;
    double revenueGenerated;

    @Builder.Default
    double hoursPerWeek = 40;

    @Builder.Default
    RoleType roleType = RoleType.OPERATIONS;
}
