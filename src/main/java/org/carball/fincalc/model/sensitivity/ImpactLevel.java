package org.carball.fincalc.model.sensitivity;

public enum ImpactLevel {
    HIGH,
    MEDIUM,
    LOW
}
