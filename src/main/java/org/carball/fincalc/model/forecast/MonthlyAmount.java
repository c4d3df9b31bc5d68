package org.carball.fincalc.model.forecast;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * An amount booked against a single forecast month (1-based).
 */
@Value
@Builder
@Jacksonized
public class MonthlyAmount {
    int month;
    double amount;
    String description;

    public static MonthlyAmount of(int month, double amount) {
        return MonthlyAmount.builder().month(month).amount(amount).build();
    }
}
