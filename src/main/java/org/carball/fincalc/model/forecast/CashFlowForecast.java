package org.carball.fincalc.model.forecast;

import java.util.List;

/**
 * @param lowestCashMonth    month of the lowest balance, 0 when the balance never drops below the start
 * @param firstDeficitMonth  first month ending below zero, {@code null} if none
 */
public record CashFlowForecast(
    List<ForecastMonth> months,
    double totalRevenue,
    double totalExpenses,
    double totalNetCashFlow,
    double endingCashBalance,
    double lowestCashBalance,
    int lowestCashMonth,
    List<Integer> deficitMonths,
    Integer firstDeficitMonth,
    double minimumCashReserve,
    double averageMonthlyNetFlow,
    boolean healthy
) {}
