package org.carball.fincalc.model.forecast;

public record ForecastMonth(
    int month,
    double revenue,
    double expenses,
    double netCashFlow,
    double endingCash,
    boolean deficit
) {}
