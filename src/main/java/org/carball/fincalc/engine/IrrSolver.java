package org.carball.fincalc.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.fincalc.config.EngineSettings;
import org.carball.fincalc.model.scenario.IrrEstimate;
import org.carball.fincalc.model.scenario.IrrStatus;

/**
 * Newton-Raphson search for the monthly rate at which the project NPV is zero.
 * Never throws on non-convergence; the returned status says how the search ended.
 */
@Slf4j
public class IrrSolver {

    private final EngineSettings settings;

    public IrrSolver() {
        this(EngineSettings.defaults());
    }

    public IrrSolver(EngineSettings settings) {
        this.settings = settings;
    }

    /**
     * @param initialInvestment outflow at month 0
     * @param cashFlows         net flow for months 1..n
     */
    public IrrEstimate solve(double initialInvestment, double[] cashFlows) {
        double rate = settings.getIrrInitialGuess();
        IrrStatus status = IrrStatus.ITERATION_LIMIT;
        int iteration = 0;

        for (; iteration < settings.getIrrMaxIterations(); iteration++) {
            double npv = npvAt(rate, initialInvestment, cashFlows);
            if (Math.abs(npv) < settings.getIrrTolerance()) {
                status = IrrStatus.CONVERGED;
                break;
            }

            double derivative = derivativeAt(rate, cashFlows);
            if (Math.abs(derivative) < settings.getIrrMinDerivative()) {
                status = IrrStatus.FLAT_DERIVATIVE;
                break;
            }

            double next = rate - npv / derivative;
            if (next <= settings.getIrrLowerBound() || next >= settings.getIrrUpperBound()) {
                log.debug("IRR step left bounds at iteration {} (rate {}), resetting to initial guess", iteration, next);
                rate = settings.getIrrInitialGuess();
                status = IrrStatus.DIVERGED_RESET;
                break;
            }
            rate = next;
        }

        double annualPercent = (Math.pow(1 + rate, 12) - 1) * 100;
        if (!status.isConverged()) {
            log.debug("IRR did not converge: status={}, iterations={}, rate={}", status, iteration, rate);
        }
        return new IrrEstimate(rate, annualPercent, iteration, status);
    }

    static double npvAt(double monthlyRate, double initialInvestment, double[] cashFlows) {
        double npv = -initialInvestment;
        double discount = 1.0;
        for (double cashFlow : cashFlows) {
            discount *= 1 + monthlyRate;
            npv += cashFlow / discount;
        }
        return npv;
    }

    private static double derivativeAt(double monthlyRate, double[] cashFlows) {
        double derivative = 0;
        for (int t = 0; t < cashFlows.length; t++) {
            int period = t + 1;
            derivative -= period * cashFlows[t] / Math.pow(1 + monthlyRate, period + 1);
        }
        return derivative;
    }
}
