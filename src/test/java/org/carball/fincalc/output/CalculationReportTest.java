package org.carball.fincalc.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.fincalc.config.EngineSettings;
import org.carball.fincalc.engine.RunwayEngine;
import org.carball.fincalc.engine.StandardMetricsEngine;
import org.carball.fincalc.model.runway.RunwayInput;
import org.carball.fincalc.model.runway.RunwayResult;
import org.carball.fincalc.model.scenario.ScenarioInput;
import org.carball.fincalc.model.scenario.StandardMetricsResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class CalculationReportTest {

    @TempDir
    Path tempDir;

    private Clock clock;
    private ObjectMapper mapper;
    private ScenarioInput scenario;
    private StandardMetricsResult result;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);
        mapper = new ObjectMapper();
        scenario = ScenarioInput.builder()
                .initialInvestment(100000)
                .discountRate(0)
                .projectDuration(12)
                .yearlyRevenue(60000)
                .operatingCosts(9000)
                .maintenanceCosts(3000)
                .build();
        result = new StandardMetricsEngine().calculate(scenario);
    }

    @Test
    void shouldIncludeMetadataInputAndResult() throws IOException {
        // Given
        CalculationReport report = new CalculationReport("metrics", scenario, result, EngineSettings.defaults(), clock);

        // When
        JsonNode json = mapper.readTree(report.toJson());

        // Then
        assertThat(json.at("/metadata/calculation").asText()).isEqualTo("metrics");
        assertThat(json.at("/metadata/engineVersion").asText()).isEqualTo(CalculationReport.ENGINE_VERSION);
        assertThat(json.at("/metadata/timestamp").asText()).isEqualTo("2026-01-15T10:00:00");
        assertThat(json.at("/metadata/settingsSource").asText()).isEqualTo("defaults");
        assertThat(json.at("/input/initialInvestment").asDouble()).isEqualTo(100000.0);
        assertThat(json.at("/result/npv").asDouble()).isEqualTo(-52000.0);
        assertThat(json.at("/result/irrStatus").isTextual()).isTrue();
        assertThat(json.at("/result/monthlyCashFlow")).hasSize(12);
    }

    @Test
    void shouldWriteDatesAsIsoStrings() throws IOException {
        // Given
        RunwayInput input = RunwayInput.builder().currentCash(60000).monthlyBurnRate(10000).build();
        RunwayResult runway = new RunwayEngine(EngineSettings.defaults(), clock).calculate(input);
        CalculationReport report = new CalculationReport("runway", input, runway, EngineSettings.defaults(), clock);

        // When
        JsonNode json = mapper.readTree(report.toJson());

        // Then
        assertThat(json.at("/result/zeroCashDate").asText()).isEqualTo("2026-07-15");
        assertThat(json.at("/result/status").asText()).isEqualTo("WARNING");
    }

    @Test
    void shouldOmitNullFields() throws IOException {
        // Given
        RunwayInput input = RunwayInput.builder().currentCash(60000).monthlyBurnRate(10000).build();
        CalculationReport report = new CalculationReport("runway", input, null, null, clock);

        // When
        JsonNode json = mapper.readTree(report.toJson());

        // Then
        assertThat(json.has("result")).isFalse();
        assertThat(json.at("/metadata").has("settingsSource")).isFalse();
        assertThat(json.at("/input").has("plannedFundraising")).isFalse();
    }

    @Test
    void shouldWriteReportCreatingDirectories() throws IOException {
        // Given
        CalculationReport report = new CalculationReport("metrics", scenario, result, EngineSettings.defaults(), clock);
        Path file = tempDir.resolve("reports/nested/metrics.json");

        // When
        report.writeTo(file);

        // Then
        assertThat(file).exists();
        assertThat(Files.readString(file)).isEqualTo(report.toJson());
    }
}
