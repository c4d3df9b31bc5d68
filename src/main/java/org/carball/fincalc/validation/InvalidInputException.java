package org.carball.fincalc.validation;

import lombok.Getter;

/**
 * Raised when a calculation input violates a range, finiteness or cross-field rule.
 * The offending field is carried so callers can point the user at it.
 */
@Getter
public class InvalidInputException extends IllegalArgumentException {

    private final String field;

    public InvalidInputException(String field, String message) {
        super(field + " " + message);
        this.field = field;
    }
}
