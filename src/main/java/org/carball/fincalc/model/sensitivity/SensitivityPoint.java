package org.carball.fincalc.model.sensitivity;

public record SensitivityPoint(
    SensitivityVariable variable,
    double variationPercent,
    double npv,
    double roi
) {}
