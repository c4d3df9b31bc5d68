package org.carball.fincalc.model.loan;

import java.util.List;

public record LoanAnalysis(
    double monthlyPayment,
    double totalPayment,
    double totalInterest,
    double effectiveAnnualRate,
    double totalCostWithFees,
    List<AmortizationEntry> amortizationSchedule,
    double firstYearPrincipal,
    double firstYearInterest,
    Affordability affordability,
    int halfwayMonth,
    double balanceAtHalfway
) {}
