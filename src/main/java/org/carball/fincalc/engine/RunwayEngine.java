package org.carball.fincalc.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.fincalc.config.EngineSettings;
import org.carball.fincalc.model.runway.RunwayInput;
import org.carball.fincalc.model.runway.RunwayResult;
import org.carball.fincalc.model.runway.RunwayStatus;
import org.carball.fincalc.validation.InputValidator;

import java.time.Clock;
import java.time.LocalDate;

import static org.carball.fincalc.validation.NumericGuards.roundCurrency;

/**
 * Months of cash left at the current burn, and the compounded effect of churn over six months.
 */
@Slf4j
public class RunwayEngine {

    private static final int CHURN_HORIZON_MONTHS = 6;

    private final EngineSettings settings;
    private final Clock clock;

    public RunwayEngine() {
        this(EngineSettings.defaults(), Clock.systemDefaultZone());
    }

    public RunwayEngine(EngineSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    public RunwayResult calculate(RunwayInput input) {
        InputValidator.validate(input);

        double runwayMonths = roundCurrency(input.totalCash() / input.getMonthlyBurnRate());
        LocalDate zeroCashDate = LocalDate.now(clock).plusMonths((long) Math.floor(runwayMonths));

        double retention = Math.pow(1 - input.getMonthlyChurnRate() / 100, CHURN_HORIZON_MONTHS);
        double churnImpact = roundCurrency((1 - retention) * 100);

        RunwayStatus status = RunwayStatus.fromMonths(runwayMonths,
                settings.getRunwayCriticalMonths(), settings.getRunwayWarningMonths());

        log.debug("Runway (months): {}", runwayMonths);
        log.debug("Churn impact over {} months (%): {}", CHURN_HORIZON_MONTHS, churnImpact);
        if (status == RunwayStatus.CRITICAL) {
            log.warn("Runway of {} months is critical, cash runs out around {}", runwayMonths, zeroCashDate);
        }

        return new RunwayResult(runwayMonths, zeroCashDate, churnImpact, status);
    }
}
