package org.carball.fincalc.model.loan;

/**
 * Debt-service view of a loan. All fields are {@code null} when the borrower's
 * revenue and expenses are unknown; that means "not assessed", not "unaffordable".
 */
public record Affordability(
    Double debtServiceRatio,
    Boolean affordable,
    Double maxAffordablePayment,
    Double cushionAfterPayment
) {
    public static Affordability unknown() {
        return new Affordability(null, null, null, null);
    }

    public boolean isAssessed() {
        return affordable != null;
    }
}
