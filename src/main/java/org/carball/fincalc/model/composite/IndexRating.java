package org.carball.fincalc.model.composite;

public enum IndexRating {
    OPTIMAL,
    ACCEPTABLE,
    CONCERNING
}
