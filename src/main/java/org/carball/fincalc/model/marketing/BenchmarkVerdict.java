package org.carball.fincalc.model.marketing;

public enum BenchmarkVerdict {
    BETTER,
    SAME,
    WORSE
}
