package org.carball.fincalc.model.loan;

public record LoanOption(
    LoanInput input,
    double monthlyPayment,
    double totalCostWithFees
) {}
