package org.carball.fincalc.model.runway;

public enum RunwayStatus {
    CRITICAL,
    WARNING,
    HEALTHY;

    public static RunwayStatus fromMonths(double runwayMonths, double criticalMonths, double warningMonths) {
        if (runwayMonths < criticalMonths) {
            return CRITICAL;
        } else if (runwayMonths < warningMonths) {
            return WARNING;
        }
        return HEALTHY;
    }
}
