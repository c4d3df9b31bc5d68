package org.carball.fincalc.model.employee;

public enum ProductivityLevel {
    HIGH,
    AVERAGE,
    LOW
}
