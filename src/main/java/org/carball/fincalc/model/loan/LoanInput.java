package org.carball.fincalc.model.loan;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Loan terms plus optional operating figures used for the affordability check.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class LoanInput {
    double principal;
    double annualInterestRate;
    int termMonths;

    // Percent of principal, deducted from the proceeds
    Double originationFeePercent;

    Double monthlyRevenue;
    Double monthlyExpenses;

    public boolean hasOperatingFigures() {
        return monthlyRevenue != null && monthlyExpenses != null;
    }
}
