package org.carball.fincalc.engine;

import org.carball.fincalc.model.scenario.ScenarioInput;
import org.carball.fincalc.model.sensitivity.ImpactLevel;
import org.carball.fincalc.model.sensitivity.SensitivityAnalysis;
import org.carball.fincalc.model.sensitivity.SensitivityMatrix;
import org.carball.fincalc.model.sensitivity.SensitivityMetric;
import org.carball.fincalc.model.sensitivity.SensitivityPoint;
import org.carball.fincalc.model.sensitivity.SensitivityVariable;
import org.carball.fincalc.model.sensitivity.TornadoEntry;
import org.carball.fincalc.validation.InvalidInputException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SensitivityEngineTest {

    private SensitivityEngine engine;
    private ScenarioInput scenario;

    @BeforeEach
    void setUp() {
        engine = new SensitivityEngine();
        scenario = ScenarioInput.builder()
                .initialInvestment(100000)
                .discountRate(10)
                .projectDuration(36)
                .yearlyRevenue(60000)
                .operatingCosts(9000)
                .maintenanceCosts(3000)
                .build();
    }

    @Test
    void shouldSweepEveryVariableOverDefaultVariations() {
        // When
        SensitivityMatrix matrix = engine.sweep(scenario);

        // Then
        assertThat(matrix.variations()).containsExactly(-30.0, -20.0, -10.0, 0.0, 10.0, 20.0, 30.0);
        assertThat(matrix.rows().keySet()).containsExactly(
                SensitivityVariable.INITIAL_INVESTMENT,
                SensitivityVariable.YEARLY_REVENUE,
                SensitivityVariable.OPERATING_COSTS,
                SensitivityVariable.MAINTENANCE_COSTS);
        assertThat(matrix.rows().values()).allSatisfy(row -> assertThat(row).hasSize(7));
    }

    @Test
    void shouldMatchBaselineAtZeroVariation() {
        // When
        SensitivityMatrix matrix = engine.sweep(scenario);

        // Then
        for (SensitivityVariable variable : matrix.rows().keySet()) {
            SensitivityPoint point = matrix.point(variable, 0).orElseThrow();
            assertThat(point.npv()).isEqualTo(matrix.baseline().npv());
            assertThat(point.roi()).isEqualTo(matrix.baseline().roi());
        }
    }

    @Test
    void shouldMoveNpvInExpectedDirection() {
        // When
        SensitivityMatrix matrix = engine.sweep(scenario);
        double baseline = matrix.baseline().npv();

        // Then
        assertThat(matrix.point(SensitivityVariable.YEARLY_REVENUE, 10).orElseThrow().npv()).isGreaterThan(baseline);
        assertThat(matrix.point(SensitivityVariable.OPERATING_COSTS, 10).orElseThrow().npv()).isLessThan(baseline);
        assertThat(matrix.point(SensitivityVariable.INITIAL_INVESTMENT, 10).orElseThrow().npv())
                .isCloseTo(baseline - 10000, within(0.01));
        assertThat(matrix.point(SensitivityVariable.MAINTENANCE_COSTS, 30).orElseThrow().npv()).isLessThan(baseline);
    }

    @Test
    void shouldSortTornadoByRange() {
        // When
        SensitivityAnalysis analysis = engine.analyze(scenario);
        List<TornadoEntry> tornado = analysis.tornado();

        // Then
        assertThat(tornado).extracting(TornadoEntry::variable).containsExactly(
                SensitivityVariable.YEARLY_REVENUE,
                SensitivityVariable.INITIAL_INVESTMENT,
                SensitivityVariable.OPERATING_COSTS,
                SensitivityVariable.MAINTENANCE_COSTS);
        for (int i = 1; i < tornado.size(); i++) {
            assertThat(tornado.get(i).range()).isLessThanOrEqualTo(tornado.get(i - 1).range());
        }
    }

    @Test
    void shouldGradeTornadoBars() {
        // When
        List<TornadoEntry> tornado = engine.analyze(scenario).tornado();

        // Then
        TornadoEntry revenue = tornado.get(0);
        assertThat(revenue.negativeVariation()).isEqualTo(-30.0);
        assertThat(revenue.positiveVariation()).isEqualTo(30.0);
        assertThat(revenue.range()).isCloseTo(92973.71, within(0.02));
        assertThat(revenue.negativeImpact()).isNegative();
        assertThat(revenue.impactLevel()).isEqualTo(ImpactLevel.HIGH);
        assertThat(revenue.riskLevel()).isEqualTo(ImpactLevel.HIGH);

        assertThat(tornado.get(1).range()).isCloseTo(60000, within(0.02));
        assertThat(tornado.get(1).impactLevel()).isEqualTo(ImpactLevel.MEDIUM);
        assertThat(tornado.get(2).range()).isCloseTo(13946.06, within(0.02));
        assertThat(tornado.get(2).impactLevel()).isEqualTo(ImpactLevel.LOW);
        assertThat(tornado.get(3).range()).isCloseTo(4648.69, within(0.02));
        assertThat(tornado.get(3).impactLevel()).isEqualTo(ImpactLevel.LOW);
    }

    @Test
    void shouldTreatMissingSideAsNoImpact() {
        // Given
        SensitivityMatrix matrix = engine.sweep(scenario,
                List.of(SensitivityVariable.YEARLY_REVENUE), List.of(10.0, 20.0));

        // When
        List<TornadoEntry> tornado = engine.tornado(matrix, SensitivityMetric.ROI);

        // Then
        assertThat(tornado).hasSize(1);
        assertThat(tornado.get(0).negativeVariation()).isZero();
        assertThat(tornado.get(0).negativeImpact()).isZero();
        assertThat(tornado.get(0).positiveVariation()).isEqualTo(20.0);
        assertThat(tornado.get(0).positiveImpact()).isPositive();
        assertThat(tornado.get(0).riskLevel()).isEqualTo(ImpactLevel.LOW);
    }

    @Test
    void shouldRejectEmptySweep() {
        assertThatThrownBy(() -> engine.sweep(scenario, List.of(), List.of(10.0)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.sweep(scenario, SensitivityVariable.defaults(), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectVariationThatWipesOutField() {
        assertThatThrownBy(() -> engine.sweep(scenario, SensitivityVariable.defaults(), List.of(-10.0, -100.0)))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("variations must be greater than -100, got -100.0")
                .extracting("field").isEqualTo("variations");

        assertThatThrownBy(() -> engine.sweep(scenario, SensitivityVariable.defaults(), List.of(-150.0)))
                .extracting("field").isEqualTo("variations");
    }

    @Test
    void shouldGradeImpactRelativeToWidestBar() {
        assertThat(SensitivityEngine.impactLevel(8, 10)).isEqualTo(ImpactLevel.HIGH);
        assertThat(SensitivityEngine.impactLevel(5, 10)).isEqualTo(ImpactLevel.MEDIUM);
        assertThat(SensitivityEngine.impactLevel(4, 10)).isEqualTo(ImpactLevel.LOW);
        assertThat(SensitivityEngine.impactLevel(0, 0)).isEqualTo(ImpactLevel.LOW);
    }

    @Test
    void shouldGradeRiskRelativeToBaselineNpv() {
        assertThat(SensitivityEngine.riskLevel(-600, 1000)).isEqualTo(ImpactLevel.HIGH);
        assertThat(SensitivityEngine.riskLevel(-300, 1000)).isEqualTo(ImpactLevel.MEDIUM);
        assertThat(SensitivityEngine.riskLevel(-250, 1000)).isEqualTo(ImpactLevel.LOW);
        assertThat(SensitivityEngine.riskLevel(-1, 0)).isEqualTo(ImpactLevel.HIGH);
        assertThat(SensitivityEngine.riskLevel(0, 0)).isEqualTo(ImpactLevel.LOW);
    }
}
