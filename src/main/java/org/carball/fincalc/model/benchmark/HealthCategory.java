package org.carball.fincalc.model.benchmark;

public enum HealthCategory {
    EXCELLENT,
    GOOD,
    FAIR,
    POOR;

    public static HealthCategory fromScore(int score) {
        if (score >= 85) {
            return EXCELLENT;
        } else if (score >= 70) {
            return GOOD;
        } else if (score >= 50) {
            return FAIR;
        }
        return POOR;
    }
}
