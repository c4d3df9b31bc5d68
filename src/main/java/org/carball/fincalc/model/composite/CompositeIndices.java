package org.carball.fincalc.model.composite;

import java.util.Map;

/**
 * Index values rounded to 4 decimals. A value is {@code null} when its input group was absent.
 */
public record CompositeIndices(
    Double ofi,
    Double tfdi,
    Double ser,
    Map<CompositeIndex, IndexRating> ratings
) {}
