package org.carball.fincalc.validation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NumericGuardsTest {

    @Test
    void shouldRejectNonFiniteValues() {
        assertThatThrownBy(() -> NumericGuards.requireFinite(Double.NaN, "rate"))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("rate must be a finite number");

        assertThatThrownBy(() -> NumericGuards.requirePositive(Double.POSITIVE_INFINITY, "principal"))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("principal");
    }

    @Test
    void shouldRejectZeroWhenPositiveRequired() {
        InvalidInputException exception = null;
        try {
            NumericGuards.requirePositive(0, "initialInvestment");
        } catch (InvalidInputException e) {
            exception = e;
        }

        assertThat(exception).isNotNull();
        assertThat(exception.getField()).isEqualTo("initialInvestment");
        assertThat(exception.getMessage()).isEqualTo("initialInvestment must be positive, got 0.0");
    }

    @Test
    void shouldAcceptZeroWhenNonNegativeRequired() {
        assertThat(NumericGuards.requireNonNegative(0, "operatingCosts")).isEqualTo(0.0);

        assertThatThrownBy(() -> NumericGuards.requireNonNegative(-0.01, "operatingCosts"))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("must be non-negative");
    }

    @Test
    void shouldIncludeBoundsInRangeMessage() {
        assertThat(NumericGuards.requireRange(100, 0, 100, "discountRate")).isEqualTo(100.0);

        assertThatThrownBy(() -> NumericGuards.requireRange(150, 0, 100, "discountRate"))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("discountRate must be between 0 and 100, got 150.0");

        assertThatThrownBy(() -> NumericGuards.requireRange(0.05, 0.1, 3.0, "seasonalFactors[0]"))
                .hasMessage("seasonalFactors[0] must be between 0.1 and 3.0, got 0.05");
    }

    @Test
    void shouldRequireValueStrictlyAboveBound() {
        assertThat(NumericGuards.requireGreaterThan(-99.5, -100, "variations")).isEqualTo(-99.5);

        assertThatThrownBy(() -> NumericGuards.requireGreaterThan(-100, -100, "variations"))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("variations must be greater than -100, got -100.0");

        assertThatThrownBy(() -> NumericGuards.requireGreaterThan(Double.NaN, -100, "variations"))
                .extracting("field").isEqualTo("variations");
    }

    @Test
    void shouldRequirePresentValues() {
        assertThat(NumericGuards.requirePresent("x", "field")).isEqualTo("x");

        assertThatThrownBy(() -> NumericGuards.requirePresent(null, "scenario"))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("scenario is required");
    }

    @Test
    void shouldReturnDefaultOnZeroDenominator() {
        assertThat(NumericGuards.safeDivide(6, 3)).isEqualTo(2.0);
        assertThat(NumericGuards.safeDivide(1, 0)).isEqualTo(0.0);
        assertThat(NumericGuards.safeDivide(1, 0, 7)).isEqualTo(7.0);
    }

    @Test
    void shouldRoundHalfUp() {
        assertThat(NumericGuards.round(3.14159, 2)).isEqualTo(3.14);
        assertThat(NumericGuards.round(2.5, 0)).isEqualTo(3.0);
        assertThat(NumericGuards.round(0.052, 4)).isEqualTo(0.052);
        assertThat(NumericGuards.roundCurrency(2027.639428)).isEqualTo(2027.64);
    }

    @Test
    void shouldKeepMagnitudeBeyondLongRange() {
        assertThat(NumericGuards.roundCurrency(4.465682541747259E97)).isEqualTo(4.465682541747259E97);
        assertThat(NumericGuards.roundCurrency(-2.0E18)).isEqualTo(-2.0E18);
        assertThat(NumericGuards.round(1.0E17 + 0.5, 0)).isEqualTo(1.0E17);
    }

    @Test
    void shouldRoundOnDecimalForm() {
        assertThat(NumericGuards.roundCurrency(1.005)).isEqualTo(1.01);
        assertThat(NumericGuards.round(-2.5, 0)).isEqualTo(-3.0);
        assertThat(NumericGuards.round(Double.POSITIVE_INFINITY, 2)).isEqualTo(Double.POSITIVE_INFINITY);
    }
}
