package org.carball.fincalc.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.fincalc.config.EngineSettings;
import org.carball.fincalc.model.scenario.IrrEstimate;
import org.carball.fincalc.model.scenario.ScenarioInput;
import org.carball.fincalc.model.scenario.StandardMetricsResult;
import org.carball.fincalc.validation.InputValidator;

import java.util.ArrayList;
import java.util.List;

import static org.carball.fincalc.validation.NumericGuards.round;
import static org.carball.fincalc.validation.NumericGuards.roundCurrency;
import static org.carball.fincalc.validation.NumericGuards.safeDivide;

/**
 * ROI, NPV, IRR and payback for a monthly-compounded project.
 * <p>
 * Month {@code t} (0-based) earns {@code yearlyRevenue / 12 * multiplier * (1 + growth / 1200)^t}
 * and pays a flat twelfth of the annual operating and maintenance costs. Cash flows are
 * discounted at {@code discountRate / 1200} per month, the first one a full period out.
 */
@Slf4j
public class StandardMetricsEngine {

    private final IrrSolver irrSolver;

    public StandardMetricsEngine() {
        this(EngineSettings.defaults());
    }

    public StandardMetricsEngine(EngineSettings settings) {
        this.irrSolver = new IrrSolver(settings);
    }

    public StandardMetricsResult calculate(ScenarioInput input) {
        InputValidator.validate(input);

        double[] cashFlows = monthlyCashFlows(input);
        double investment = input.getInitialInvestment();
        double monthlyRate = input.getDiscountRate() / 100 / 12;

        double npv = IrrSolver.npvAt(monthlyRate, investment, cashFlows);
        double roi = npv / investment * 100;

        List<Double> monthly = new ArrayList<>(cashFlows.length);
        List<Double> cumulative = new ArrayList<>(cashFlows.length);
        double running = -investment;
        double total = 0;
        double payback = input.getProjectDuration();
        boolean paybackAchieved = false;

        for (int m = 0; m < cashFlows.length; m++) {
            double previous = running;
            running += cashFlows[m];
            total += cashFlows[m];
            monthly.add(roundCurrency(cashFlows[m]));
            cumulative.add(roundCurrency(running));

            if (!paybackAchieved && running >= 0) {
                payback = m + safeDivide(-previous, cashFlows[m]);
                paybackAchieved = true;
            }
        }

        IrrEstimate irr = irrSolver.solve(investment, cashFlows);

        log.debug("NPV: {}", npv);
        log.debug("ROI (%): {}", roi);
        log.debug("IRR (%): {} [{}]", irr.annualPercent(), irr.status());
        log.debug("Payback (months): {}{}", payback, paybackAchieved ? "" : " (not reached)");

        return new StandardMetricsResult(
                roundCurrency(roi),
                roundCurrency(npv),
                roundCurrency(irr.annualPercent()),
                irr.status(),
                round(payback, 2),
                paybackAchieved,
                List.copyOf(monthly),
                List.copyOf(cumulative),
                roundCurrency(total));
    }

    /**
     * Net cash flow for months 1..projectDuration, unrounded.
     */
    public double[] monthlyCashFlows(ScenarioInput input) {
        int months = input.getProjectDuration();
        double baseRevenue = input.getYearlyRevenue() / 12 * input.getMultiplier();
        double growthFactor = 1 + input.getRevenueGrowth() / 100 / 12;
        double monthlyCosts = (input.getOperatingCosts() + input.getMaintenanceCosts()) / 12;

        double[] cashFlows = new double[months];
        for (int t = 0; t < months; t++) {
            cashFlows[t] = baseRevenue * Math.pow(growthFactor, t) - monthlyCosts;
        }
        return cashFlows;
    }
}
