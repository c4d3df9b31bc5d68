package org.carball.fincalc.model.loan;

/**
 * One month of an amortization schedule. {@code balance} is the balance after the payment.
 */
public record AmortizationEntry(
    int month,
    double payment,
    double principal,
    double interest,
    double balance
) {}
