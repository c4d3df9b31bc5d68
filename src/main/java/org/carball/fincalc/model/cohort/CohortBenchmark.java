package org.carball.fincalc.model.cohort;

import lombok.Getter;
import org.carball.fincalc.model.composite.IndexRating;

/**
 * Bands for cohort profitability. Values below {@code critical} lose money.
 */
@Getter
public enum CohortBenchmark {

    CONTRIBUTION_MARGIN(40, 20, 0),
    PROFITABILITY_INDEX(2.0, 1.0, 0);

    private final double optimal;
    private final double acceptable;
    private final double critical;

    CohortBenchmark(double optimal, double acceptable, double critical) {
        this.optimal = optimal;
        this.acceptable = acceptable;
        this.critical = critical;
    }

    public IndexRating rate(double value) {
        if (value >= optimal) return IndexRating.OPTIMAL;
        if (value >= acceptable) return IndexRating.ACCEPTABLE;
        return IndexRating.CONCERNING;
    }
}
