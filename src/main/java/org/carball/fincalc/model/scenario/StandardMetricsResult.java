package org.carball.fincalc.model.scenario;

import java.util.List;

public record StandardMetricsResult(
    double roi,
    double npv,
    double irr,
    IrrStatus irrStatus,
    double paybackPeriod,
    boolean paybackAchieved,
    List<Double> monthlyCashFlow,
    List<Double> cumulativeCashFlow,
    double totalNetCashFlow
) {}
