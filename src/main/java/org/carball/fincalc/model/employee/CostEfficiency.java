package org.carball.fincalc.model.employee;

/**
 * Cost per hour against the role average. {@code ABOVE} means cheaper than average.
 */
public enum CostEfficiency {
    ABOVE,
    AVERAGE,
    BELOW
}
