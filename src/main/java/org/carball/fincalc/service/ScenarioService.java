package org.carball.fincalc.service;

import lombok.extern.slf4j.Slf4j;
import org.carball.fincalc.config.EngineSettings;
import org.carball.fincalc.model.scenario.ScenarioAdjustment;
import org.carball.fincalc.model.scenario.ScenarioComparison;
import org.carball.fincalc.model.scenario.ScenarioInput;
import org.carball.fincalc.model.scenario.ScenarioSet;
import org.carball.fincalc.model.scenario.StandardMetricsResult;
import org.carball.fincalc.validation.InputValidator;

import static org.carball.fincalc.validation.NumericGuards.requireFinite;
import static org.carball.fincalc.validation.NumericGuards.requirePresent;
import static org.carball.fincalc.validation.NumericGuards.round;
import static org.carball.fincalc.validation.NumericGuards.roundCurrency;

/**
 * Expected/best/worst cases and what-if comparisons on top of the standard metrics.
 */
@Slf4j
public class ScenarioService {

    private final OffloadedCalculationClient client;
    private final EngineSettings settings;

    public ScenarioService(OffloadedCalculationClient client, EngineSettings settings) {
        this.client = client;
        this.settings = settings;
    }

    public StandardMetricsResult calculate(ScenarioInput input) {
        return client.calculate(input);
    }

    /**
     * Recomputes the scenario with the expected, best and worst revenue multipliers.
     * Each case is independent; the input's own multiplier is replaced.
     */
    public ScenarioSet calculateScenarios(ScenarioInput input) {
        InputValidator.validate(input);

        double best = settings.getBestCaseMultiplier();
        double worst = settings.getWorstCaseMultiplier();

        StandardMetricsResult expectedResult = client.calculate(input.withMultiplier(1.0));
        StandardMetricsResult bestResult = client.calculate(input.withMultiplier(best));
        StandardMetricsResult worstResult = client.calculate(input.withMultiplier(worst));

        log.info("Scenarios NPV - worst: {}, expected: {}, best: {}",
                worstResult.npv(), expectedResult.npv(), bestResult.npv());
        return new ScenarioSet(expectedResult, bestResult, worstResult, best, worst);
    }

    public StandardMetricsResult calculateWithAdjustments(ScenarioInput base, ScenarioAdjustment adjustment) {
        return client.calculate(adjust(base, adjustment));
    }

    public ScenarioComparison compare(ScenarioInput base, ScenarioAdjustment adjustment) {
        StandardMetricsResult baseResult = client.calculate(base);
        StandardMetricsResult adjusted = calculateWithAdjustments(base, adjustment);

        return new ScenarioComparison(baseResult, adjusted,
                roundCurrency(adjusted.roi() - baseResult.roi()),
                roundCurrency(adjusted.npv() - baseResult.npv()),
                round(adjusted.paybackPeriod() - baseResult.paybackPeriod(), 2),
                roundCurrency(adjusted.irr() - baseResult.irr()));
    }

    /**
     * Revenue scales by the sales change, both cost lines by the cost change, and the
     * discount rate shifts by the given points. The adjusted scenario is validated as a whole.
     */
    static ScenarioInput adjust(ScenarioInput base, ScenarioAdjustment adjustment) {
        requirePresent(base, "scenario");
        requirePresent(adjustment, "adjustment");
        double sales = 1 + requireFinite(adjustment.getSalesPercent(), "salesPercent") / 100;
        double costs = 1 + requireFinite(adjustment.getCostsPercent(), "costsPercent") / 100;
        double discount = requireFinite(adjustment.getDiscountPoints(), "discountPoints");

        return base.toBuilder()
                .yearlyRevenue(base.getYearlyRevenue() * sales)
                .operatingCosts(base.getOperatingCosts() * costs)
                .maintenanceCosts(base.getMaintenanceCosts() * costs)
                .discountRate(base.getDiscountRate() + discount)
                .build();
    }
}
