package org.carball.fincalc.validation;

import org.carball.fincalc.model.breakeven.BreakEvenInput;
import org.carball.fincalc.model.cohort.CohortInput;
import org.carball.fincalc.model.composite.EfficiencyInputs;
import org.carball.fincalc.model.composite.FrictionInputs;
import org.carball.fincalc.model.composite.TechDebtInputs;
import org.carball.fincalc.model.employee.EmployeeInput;
import org.carball.fincalc.model.forecast.CashFlowForecastInput;
import org.carball.fincalc.model.forecast.MonthlyAmount;
import org.carball.fincalc.model.loan.LoanInput;
import org.carball.fincalc.model.marketing.MarketingInput;
import org.carball.fincalc.model.pricing.PricingInput;
import org.carball.fincalc.model.runway.RunwayInput;
import org.carball.fincalc.model.saas.SaasInput;
import org.carball.fincalc.model.scenario.ScenarioInput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InputValidatorTest {

    private ScenarioInput scenario;
    private LoanInput loan;
    private CashFlowForecastInput forecast;

    @BeforeEach
    void setUp() {
        scenario = ScenarioInput.builder()
                .initialInvestment(100000)
                .discountRate(10)
                .projectDuration(36)
                .yearlyRevenue(60000)
                .revenueGrowth(5)
                .operatingCosts(9000)
                .maintenanceCosts(3000)
                .build();

        loan = LoanInput.builder()
                .principal(100000)
                .annualInterestRate(8)
                .termMonths(60)
                .build();

        forecast = CashFlowForecastInput.builder()
                .startingCash(10000)
                .monthlyRevenue(20000)
                .monthlyExpenses(15000)
                .build();
    }

    @Test
    void shouldAcceptValidScenario() {
        assertThatCode(() -> InputValidator.validate(scenario)).doesNotThrowAnyException();
    }

    @Test
    void shouldRejectNullScenario() {
        assertThatThrownBy(() -> InputValidator.validate((ScenarioInput) null))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("scenario is required");
    }

    @Test
    void shouldNameOffendingScenarioField() {
        assertThatThrownBy(() -> InputValidator.validate(scenario.toBuilder().initialInvestment(-1).build()))
                .isInstanceOf(InvalidInputException.class)
                .extracting("field").isEqualTo("initialInvestment");

        assertThatThrownBy(() -> InputValidator.validate(scenario.toBuilder().discountRate(101).build()))
                .extracting("field").isEqualTo("discountRate");

        assertThatThrownBy(() -> InputValidator.validate(scenario.toBuilder().projectDuration(0).build()))
                .extracting("field").isEqualTo("projectDuration");

        assertThatThrownBy(() -> InputValidator.validate(scenario.toBuilder().yearlyRevenue(Double.NaN).build()))
                .extracting("field").isEqualTo("yearlyRevenue");

        assertThatThrownBy(() -> InputValidator.validate(scenario.toBuilder().operatingCosts(-5).build()))
                .extracting("field").isEqualTo("operatingCosts");

        assertThatThrownBy(() -> InputValidator.validate(scenario.withMultiplier(0)))
                .extracting("field").isEqualTo("multiplier");
    }

    @Test
    void shouldRejectZeroScenarioCosts() {
        assertThatThrownBy(() -> InputValidator.validate(scenario.toBuilder().operatingCosts(0).build()))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("operatingCosts must be positive, got 0.0");

        assertThatThrownBy(() -> InputValidator.validate(scenario.toBuilder().maintenanceCosts(0).build()))
                .extracting("field").isEqualTo("maintenanceCosts");
    }

    @Test
    void shouldValidateLoanBounds() {
        assertThatCode(() -> InputValidator.validate(loan)).doesNotThrowAnyException();

        assertThatThrownBy(() -> InputValidator.validate(loan.toBuilder().termMonths(361).build()))
                .extracting("field").isEqualTo("termMonths");

        assertThatThrownBy(() -> InputValidator.validate(loan.toBuilder().originationFeePercent(11.0).build()))
                .extracting("field").isEqualTo("originationFeePercent");

        assertThatThrownBy(() -> InputValidator.validate(loan.toBuilder().monthlyExpenses(-1.0).build()))
                .extracting("field").isEqualTo("monthlyExpenses");
    }

    @Test
    void shouldAcceptZeroInterestLoan() {
        assertThatCode(() -> InputValidator.validate(loan.toBuilder().annualInterestRate(0).build()))
                .doesNotThrowAnyException();
    }

    @Test
    void shouldRejectSeasonalFactorsOutOfRange() {
        CashFlowForecastInput lowFactor = forecast.toBuilder().seasonalFactor(1.0).seasonalFactor(0.05).build();

        assertThatThrownBy(() -> InputValidator.validate(lowFactor))
                .isInstanceOf(InvalidInputException.class)
                .extracting("field").isEqualTo("seasonalFactors[1]");
    }

    @Test
    void shouldRejectMoreThanTwelveSeasonalFactors() {
        CashFlowForecastInput tooMany = forecast.toBuilder()
                .seasonalFactors(Collections.nCopies(13, 1.0))
                .build();

        assertThatThrownBy(() -> InputValidator.validate(tooMany))
                .hasMessageContaining("at most 12 entries");
    }

    @Test
    void shouldRejectOneTimeExpenseOutsideHorizon() {
        CashFlowForecastInput input = forecast.toBuilder()
                .oneTimeExpense(MonthlyAmount.of(61, 500))
                .build();

        assertThatThrownBy(() -> InputValidator.validate(input))
                .extracting("field").isEqualTo("oneTimeExpenses[0].month");
    }

    @Test
    void shouldRejectForecastHorizonAboveLimit() {
        assertThatThrownBy(() -> InputValidator.validate(forecast.toBuilder().forecastMonths(61).build()))
                .extracting("field").isEqualTo("forecastMonths");
    }

    @Test
    void shouldRejectMaintenanceHoursAboveTotal() {
        TechDebtInputs input = TechDebtInputs.builder()
                .maintenanceHoursPerSprint(120)
                .totalDevHoursPerSprint(100)
                .teamAnnualCost(500000)
                .incidentCostPerMonth(2000)
                .build();

        assertThatThrownBy(() -> InputValidator.validate(input))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("must not exceed totalDevHoursPerSprint")
                .extracting("field").isEqualTo("maintenanceHoursPerSprint");
    }

    @Test
    void shouldRequirePositivePreviousPeriods() {
        EfficiencyInputs input = EfficiencyInputs.builder()
                .currentRevenue(100)
                .previousRevenue(0)
                .currentBurnRate(50)
                .previousBurnRate(50)
                .build();

        assertThatThrownBy(() -> InputValidator.validate(input))
                .extracting("field").isEqualTo("previousRevenue");
    }

    @Test
    void shouldRequirePositiveRevenueForFriction() {
        FrictionInputs input = FrictionInputs.builder()
                .manualHoursPerWeek(20)
                .hourlyCost(50)
                .currentRevenue(0)
                .build();

        assertThatThrownBy(() -> InputValidator.validate(input))
                .extracting("field").isEqualTo("currentRevenue");
    }

    @Test
    void shouldRejectPriceNotAboveVariableCost() {
        BreakEvenInput input = BreakEvenInput.builder()
                .fixedCosts(50000)
                .pricePerUnit(10)
                .variableCostPerUnit(10)
                .build();

        assertThatThrownBy(() -> InputValidator.validate(input))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("must be greater than variableCostPerUnit")
                .extracting("field").isEqualTo("pricePerUnit");
    }

    @Test
    void shouldValidateRunwayInputs() {
        RunwayInput valid = RunwayInput.builder().currentCash(0).monthlyBurnRate(1000).build();
        assertThatCode(() -> InputValidator.validate(valid)).doesNotThrowAnyException();

        assertThatThrownBy(() -> InputValidator.validate(valid.toBuilder().monthlyBurnRate(0).build()))
                .extracting("field").isEqualTo("monthlyBurnRate");

        assertThatThrownBy(() -> InputValidator.validate(valid.toBuilder().monthlyChurnRate(120).build()))
                .extracting("field").isEqualTo("monthlyChurnRate");
    }

    @Test
    void shouldRejectZeroCompositeInputs() {
        FrictionInputs friction = FrictionInputs.builder()
                .manualHoursPerWeek(20)
                .hourlyCost(50)
                .currentRevenue(1_000_000)
                .build();
        TechDebtInputs techDebt = TechDebtInputs.builder()
                .maintenanceHoursPerSprint(20)
                .totalDevHoursPerSprint(100)
                .teamAnnualCost(500000)
                .incidentCostPerMonth(5000)
                .build();
        EfficiencyInputs efficiency = EfficiencyInputs.builder()
                .currentRevenue(120)
                .previousRevenue(100)
                .currentBurnRate(105)
                .previousBurnRate(100)
                .build();

        assertThatThrownBy(() -> InputValidator.validate(friction.toBuilder().manualHoursPerWeek(0).build()))
                .extracting("field").isEqualTo("manualHoursPerWeek");
        assertThatThrownBy(() -> InputValidator.validate(friction.toBuilder().hourlyCost(0).build()))
                .extracting("field").isEqualTo("hourlyCost");
        assertThatThrownBy(() -> InputValidator.validate(techDebt.toBuilder().maintenanceHoursPerSprint(0).build()))
                .extracting("field").isEqualTo("maintenanceHoursPerSprint");
        assertThatThrownBy(() -> InputValidator.validate(techDebt.toBuilder().incidentCostPerMonth(0).build()))
                .extracting("field").isEqualTo("incidentCostPerMonth");
        assertThatThrownBy(() -> InputValidator.validate(efficiency.toBuilder().currentRevenue(0).build()))
                .extracting("field").isEqualTo("currentRevenue");
        assertThatThrownBy(() -> InputValidator.validate(efficiency.toBuilder().currentBurnRate(0).build()))
                .extracting("field").isEqualTo("currentBurnRate");
    }

    @Test
    void shouldValidatePricingInputs() {
        PricingInput valid = PricingInput.builder().costPerUnit(15).desiredMargin(40).build();
        assertThatCode(() -> InputValidator.validate(valid)).doesNotThrowAnyException();

        assertThatThrownBy(() -> InputValidator.validate(valid.toBuilder().costPerUnit(0).build()))
                .extracting("field").isEqualTo("costPerUnit");
        assertThatThrownBy(() -> InputValidator.validate(valid.toBuilder().desiredMargin(100).build()))
                .hasMessage("desiredMargin must be between 0 and 99, got 100.0");
        assertThatThrownBy(() -> InputValidator.validate(valid.toBuilder().targetVolume(0.0).build()))
                .extracting("field").isEqualTo("targetVolume");
    }

    @Test
    void shouldValidateMarketingInputs() {
        MarketingInput valid = MarketingInput.builder()
                .totalSpend(1000)
                .conversions(0)
                .revenuePerConversion(50)
                .build();
        assertThatCode(() -> InputValidator.validate(valid)).doesNotThrowAnyException();

        assertThatThrownBy(() -> InputValidator.validate(valid.toBuilder().conversions(-1).build()))
                .extracting("field").isEqualTo("conversions");
        assertThatThrownBy(() -> InputValidator.validate(valid.toBuilder().channel(null).build()))
                .extracting("field").isEqualTo("channel");
        assertThatThrownBy(() -> InputValidator.validate(valid.toBuilder().clicks(-5.0).build()))
                .extracting("field").isEqualTo("clicks");
    }

    @Test
    void shouldValidateEmployeeInputs() {
        EmployeeInput valid = EmployeeInput.builder().annualSalary(60000).revenueGenerated(0).build();
        assertThatCode(() -> InputValidator.validate(valid)).doesNotThrowAnyException();

        assertThatThrownBy(() -> InputValidator.validate(valid.toBuilder().annualSalary(0).build()))
                .extracting("field").isEqualTo("annualSalary");
        assertThatThrownBy(() -> InputValidator.validate(valid.toBuilder().hoursPerWeek(0).build()))
                .extracting("field").isEqualTo("hoursPerWeek");
    }

    @Test
    void shouldValidateSaasInputs() {
        SaasInput valid = SaasInput.builder()
                .averageRevenuePerUser(100)
                .churnRate(5)
                .cacCost(400)
                .grossMargin(80)
                .startingMrr(10000)
                .revenueGrowthRate(-20)
                .profitMargin(-50)
                .build();
        assertThatCode(() -> InputValidator.validate(valid)).doesNotThrowAnyException();

        assertThatThrownBy(() -> InputValidator.validate(valid.toBuilder().startingMrr(0).build()))
                .extracting("field").isEqualTo("startingMrr");
        assertThatThrownBy(() -> InputValidator.validate(valid.toBuilder().churnedMrr(-1).build()))
                .extracting("field").isEqualTo("churnedMrr");
        assertThatThrownBy(() -> InputValidator.validate(valid.toBuilder().profitMargin(-150).build()))
                .extracting("field").isEqualTo("profitMargin");
    }

    @Test
    void shouldValidateCohortInputs() {
        CohortInput valid = CohortInput.builder()
                .cohortName("SMB")
                .cohortRevenue(1000)
                .customerCount(10)
                .build();
        assertThatCode(() -> InputValidator.validate(valid)).doesNotThrowAnyException();

        assertThatThrownBy(() -> InputValidator.validate(valid.toBuilder().cohortName(null).build()))
                .hasMessage("cohortName is required");
        assertThatThrownBy(() -> InputValidator.validate(valid.toBuilder().customerCount(0).build()))
                .extracting("field").isEqualTo("customerCount");
        assertThatThrownBy(() -> InputValidator.validate(valid.toBuilder().directCosts(-1).build()))
                .extracting("field").isEqualTo("directCosts");
    }
}
