package org.carball.fincalc.model.scenario;

/**
 * How the IRR solver terminated. Anything other than {@link #CONVERGED}
 * means the reported IRR is an approximation.
 */
public enum IrrStatus {
    CONVERGED,
    FLAT_DERIVATIVE,
    DIVERGED_RESET,
    ITERATION_LIMIT;

    public boolean isConverged() {
        return this == CONVERGED;
    }
}
