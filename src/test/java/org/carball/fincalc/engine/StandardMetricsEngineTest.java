package org.carball.fincalc.engine;

import org.carball.fincalc.model.scenario.IrrStatus;
import org.carball.fincalc.model.scenario.ScenarioInput;
import org.carball.fincalc.model.scenario.StandardMetricsResult;
import org.carball.fincalc.validation.InvalidInputException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.assertj.core.api.Assertions.withinPercentage;

class StandardMetricsEngineTest {

    private StandardMetricsEngine engine;
    private ScenarioInput scenario;

    @BeforeEach
    void setUp() {
        engine = new StandardMetricsEngine();

        // 5000 revenue and 1000 costs per month
        scenario = ScenarioInput.builder()
                .initialInvestment(100000)
                .discountRate(10)
                .projectDuration(36)
                .yearlyRevenue(60000)
                .revenueGrowth(0)
                .operatingCosts(9000)
                .maintenanceCosts(3000)
                .build();
    }

    @Test
    void shouldMatchUndiscountedTotalAtZeroRate() {
        // When
        StandardMetricsResult result = engine.calculate(scenario.toBuilder().discountRate(0).build());

        // Then
        assertThat(result.npv()).isCloseTo(44000, within(0.01));
        assertThat(result.roi()).isCloseTo(44.0, within(0.01));
        assertThat(result.totalNetCashFlow()).isEqualTo(144000.0);
    }

    @Test
    void shouldDiscountAtMonthlyRate() {
        // When
        StandardMetricsResult result = engine.calculate(scenario);

        // Then
        assertThat(result.npv()).isCloseTo(23964.94, within(0.01));
        assertThat(result.roi()).isCloseTo(23.96, within(0.01));
        assertThat(result.irrStatus()).isEqualTo(IrrStatus.CONVERGED);
        assertThat(result.irr()).isCloseTo(28.64, within(0.01));
    }

    @Test
    void shouldInterpolatePaybackWithinMonth() {
        // When
        StandardMetricsResult result = engine.calculate(scenario);

        // Then
        assertThat(result.paybackAchieved()).isTrue();
        assertThat(result.paybackPeriod()).isEqualTo(25.0);
    }

    @Test
    void shouldReportDurationWhenPaybackNotReached() {
        // When
        StandardMetricsResult result = engine.calculate(scenario.toBuilder().initialInvestment(1_000_000).build());

        // Then
        assertThat(result.paybackAchieved()).isFalse();
        assertThat(result.paybackPeriod()).isEqualTo(36.0);
        assertThat(result.npv()).isNegative();
    }

    @Test
    void shouldBuildMonthlyAndCumulativeSeries() {
        // When
        StandardMetricsResult result = engine.calculate(scenario);

        // Then
        assertThat(result.monthlyCashFlow()).hasSize(36).containsOnly(4000.0);
        assertThat(result.cumulativeCashFlow()).hasSize(36);
        assertThat(result.cumulativeCashFlow().get(0)).isEqualTo(-96000.0);
        assertThat(result.cumulativeCashFlow().get(35)).isEqualTo(44000.0);
    }

    @Test
    void shouldCompoundRevenueGrowthMonthly() {
        // When
        StandardMetricsResult result = engine.calculate(scenario.toBuilder().revenueGrowth(12).build());

        // Then
        assertThat(result.monthlyCashFlow().get(0)).isEqualTo(4000.0);
        assertThat(result.monthlyCashFlow().get(1)).isEqualTo(4050.0);
    }

    @Test
    void shouldIncreaseNpvWithRevenueMultiplier() {
        // When
        StandardMetricsResult base = engine.calculate(scenario);
        StandardMetricsResult boosted = engine.calculate(scenario.withMultiplier(1.3));
        StandardMetricsResult reduced = engine.calculate(scenario.withMultiplier(0.7));

        // Then
        assertThat(boosted.npv()).isGreaterThan(base.npv());
        assertThat(reduced.npv()).isLessThan(base.npv());
    }

    @Test
    void shouldReportNpvBeyondLongRangeUnchanged() {
        // Given 1000% annual growth compounding over 30 years
        ScenarioInput explosive = scenario.toBuilder()
                .yearlyRevenue(150000)
                .revenueGrowth(1000)
                .projectDuration(360)
                .build();
        double rawNpv = IrrSolver.npvAt(10.0 / 100 / 12, 100000, engine.monthlyCashFlows(explosive));

        // When
        StandardMetricsResult result = engine.calculate(explosive);

        // Then
        assertThat(rawNpv).isGreaterThan(1e90);
        assertThat(result.npv()).isCloseTo(rawNpv, withinPercentage(0.0001));
        assertThat(result.roi()).isCloseTo(rawNpv / 100000 * 100, withinPercentage(0.0001));
    }

    @Test
    void shouldRejectInvalidInput() {
        assertThatThrownBy(() -> engine.calculate(scenario.toBuilder().initialInvestment(-1).build()))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("initialInvestment");
    }
}
