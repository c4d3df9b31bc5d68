package org.carball.fincalc.validation;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Shared numeric checks and helpers used by every engine.
 */
public final class NumericGuards {

    private NumericGuards() {
    }

    public static double requireFinite(double value, String field) {
        if (!Double.isFinite(value)) {
            throw new InvalidInputException(field, "must be a finite number, got " + value);
        }
        return value;
    }

    /**
     * Requires a strictly positive, finite value.
     */
    public static double requirePositive(double value, String field) {
        requireFinite(value, field);
        if (value <= 0) {
            throw new InvalidInputException(field, "must be positive, got " + value);
        }
        return value;
    }

    public static double requireNonNegative(double value, String field) {
        requireFinite(value, field);
        if (value < 0) {
            throw new InvalidInputException(field, "must be non-negative, got " + value);
        }
        return value;
    }

    public static double requireGreaterThan(double value, double bound, String field) {
        requireFinite(value, field);
        if (value <= bound) {
            throw new InvalidInputException(field, "must be greater than " + formatBound(bound) + ", got " + value);
        }
        return value;
    }

    /**
     * Requires {@code min <= value <= max}.
     */
    public static double requireRange(double value, double min, double max, String field) {
        requireFinite(value, field);
        if (value < min || value > max) {
            throw new InvalidInputException(field,
                    "must be between " + formatBound(min) + " and " + formatBound(max) + ", got " + value);
        }
        return value;
    }

    public static <T> T requirePresent(T value, String field) {
        if (value == null) {
            throw new InvalidInputException(field, "is required");
        }
        return value;
    }

    /**
     * Divides, returning {@code defaultValue} when the denominator is zero.
     */
    public static double safeDivide(double numerator, double denominator, double defaultValue) {
        if (denominator == 0) {
            return defaultValue;
        }
        return numerator / denominator;
    }

    public static double safeDivide(double numerator, double denominator) {
        return safeDivide(numerator, denominator, 0);
    }

    /**
     * Half-up rounding to the given number of decimals. Works on the decimal form of the
     * value, so magnitudes beyond the {@code long} range keep their value.
     */
    public static double round(double value, int decimals) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_UP).doubleValue();
    }

    public static double roundCurrency(double value) {
        return round(value, 2);
    }

    private static String formatBound(double bound) {
        return bound == Math.rint(bound) ? String.valueOf((long) bound) : String.valueOf(bound);
    }
}
