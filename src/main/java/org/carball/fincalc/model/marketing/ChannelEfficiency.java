package org.carball.fincalc.model.marketing;

public enum ChannelEfficiency {
    EXCELLENT,
    GOOD,
    AVERAGE,
    POOR
}
