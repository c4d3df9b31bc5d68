package org.carball.fincalc.model.loan;

import java.util.List;

/**
 * @param bestOptionIndex index into {@code options} of the cheapest loan by total cost with fees
 * @param savings         cost difference between the most and the least expensive option
 */
public record LoanComparison(
    List<LoanOption> options,
    int bestOptionIndex,
    double savings
) {}
