package org.carball.fincalc.model.composite;

import lombok.Getter;

/**
 * The three proprietary indices with their benchmark bands.
 */
@Getter
public enum CompositeIndex {

    OFI("Operational Friction Index", false, 0.03, 0.08, 0.10),
    TFDI("Tech-Debt Financial Drag Index", false, 0.15, 0.25, 0.30),
    SER("Strategic Efficiency Ratio", true, 2.0, 1.0, 1.2);

    private final String displayName;
    private final boolean higherIsBetter;
    private final double optimal;
    private final double acceptable;
    private final double industryAverage;

    CompositeIndex(String displayName, boolean higherIsBetter,
                   double optimal, double acceptable, double industryAverage) {
        this.displayName = displayName;
        this.higherIsBetter = higherIsBetter;
        this.optimal = optimal;
        this.acceptable = acceptable;
        this.industryAverage = industryAverage;
    }

    public IndexRating rate(double value) {
        if (higherIsBetter) {
            if (value > optimal) return IndexRating.OPTIMAL;
            if (value > acceptable) return IndexRating.ACCEPTABLE;
            return IndexRating.CONCERNING;
        }
        if (value < optimal) return IndexRating.OPTIMAL;
        if (value < acceptable) return IndexRating.ACCEPTABLE;
        return IndexRating.CONCERNING;
    }
}
