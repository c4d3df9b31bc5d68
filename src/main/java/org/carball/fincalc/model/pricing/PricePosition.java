package org.carball.fincalc.model.pricing;

public enum PricePosition {
    ABOVE,
    BELOW,
    SAME
}
