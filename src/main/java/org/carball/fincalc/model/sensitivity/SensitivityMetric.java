package org.carball.fincalc.model.sensitivity;

public enum SensitivityMetric {
    NPV,
    ROI;

    public double valueOf(SensitivityPoint point) {
        return this == NPV ? point.npv() : point.roi();
    }
}
