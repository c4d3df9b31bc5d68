package org.carball.fincalc.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.fincalc.model.breakeven.BreakEvenInput;
import org.carball.fincalc.model.breakeven.BreakEvenResult;
import org.carball.fincalc.validation.InputValidator;
import org.carball.fincalc.validation.InvalidInputException;

import java.math.BigDecimal;
import java.math.RoundingMode;

import static org.carball.fincalc.validation.NumericGuards.round;
import static org.carball.fincalc.validation.NumericGuards.roundCurrency;
import static org.carball.fincalc.validation.NumericGuards.safeDivide;

/**
 * Units and revenue needed to cover fixed costs. Units are whole: a fractional
 * break-even point is rounded up to the next unit sold.
 */
@Slf4j
public class BreakEvenEngine {

    public BreakEvenResult calculate(BreakEvenInput input) {
        InputValidator.validate(input);

        double contributionMargin = input.getPricePerUnit() - input.getVariableCostPerUnit();
        double contributionMarginRatio = contributionMargin / input.getPricePerUnit() * 100;

        long breakEvenUnits = breakEvenUnits(input);
        double breakEvenRevenue = breakEvenUnits * input.getPricePerUnit();

        Double marginOfSafety = null;
        Long marginOfSafetyUnits = null;
        boolean aboveBreakEven = false;
        if (input.getCurrentSalesUnits() != null) {
            double currentSales = input.getCurrentSalesUnits();
            double surplusUnits = currentSales - breakEvenUnits;
            marginOfSafetyUnits = Math.round(surplusUnits);
            marginOfSafety = round(safeDivide(surplusUnits, currentSales) * 100, 2);
            aboveBreakEven = currentSales >= breakEvenUnits;
        }

        int periodMonths = input.getPeriodMonths();
        long unitsPerMonth = Math.round((double) breakEvenUnits / periodMonths);
        double revenuePerMonth = breakEvenRevenue / periodMonths;

        log.debug("Break-even units: {}", breakEvenUnits);
        log.debug("Break-even revenue: {}", breakEvenRevenue);
        log.debug("Contribution margin ratio (%): {}", contributionMarginRatio);

        return new BreakEvenResult(
                breakEvenUnits,
                roundCurrency(breakEvenRevenue),
                roundCurrency(contributionMargin),
                roundCurrency(contributionMarginRatio),
                marginOfSafety,
                marginOfSafetyUnits,
                aboveBreakEven,
                unitsPerMonth,
                roundCurrency(revenuePerMonth));
    }

    /**
     * Divides on the decimal form of the inputs so a quotient that is exact in decimal
     * gets no extra unit from binary noise, and any true remainder still rounds up.
     */
    static long breakEvenUnits(BreakEvenInput input) {
        BigDecimal margin = BigDecimal.valueOf(input.getPricePerUnit())
                .subtract(BigDecimal.valueOf(input.getVariableCostPerUnit()));
        try {
            return BigDecimal.valueOf(input.getFixedCosts())
                    .divide(margin, 0, RoundingMode.CEILING)
                    .longValueExact();
        } catch (ArithmeticException e) {
            throw new InvalidInputException("fixedCosts", "gives a break-even point beyond " + Long.MAX_VALUE + " units");
        }
    }
}
