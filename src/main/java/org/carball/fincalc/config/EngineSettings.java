package org.carball.fincalc.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

@Data
@Builder(toBuilder = true)
@Jacksonized
@Slf4j
public class EngineSettings {

    // IRR solver
    @Builder.Default
    private double irrInitialGuess = 0.10 / 12;

    @Builder.Default
    private double irrTolerance = 1e-4;

    @Builder.Default
    private int irrMaxIterations = 100;

    @Builder.Default
    private double irrMinDerivative = 1e-10;

    @Builder.Default
    private double irrLowerBound = -0.99;

    @Builder.Default
    private double irrUpperBound = 10.0;

    // Loans
    @Builder.Default
    private double affordabilityLimitPercent = 40.0;

    // Forecasting
    @Builder.Default
    private int defaultForecastMonths = 12;

    @Builder.Default
    private double deficitReserveMultiplier = 3.0;

    @Builder.Default
    private double expenseReserveMultiplier = 2.0;

    // Scenarios
    @Builder.Default
    private double bestCaseMultiplier = 1.3;

    @Builder.Default
    private double worstCaseMultiplier = 0.7;

    @Builder.Default
    private List<Double> sensitivityVariations = List.of(-30.0, -20.0, -10.0, 0.0, 10.0, 20.0, 30.0);

    // Offloading
    @Builder.Default
    private int offloadThresholdMonths = 24;

    @Builder.Default
    private long offloadTimeoutMillis = 30_000;

    @Builder.Default
    private int workerThreads = 2;

    // Runway
    @Builder.Default
    private double runwayCriticalMonths = 6.0;

    @Builder.Default
    private double runwayWarningMonths = 12.0;

    @Builder.Default
    private String source = "defaults";

    /**
     * Creates the built-in settings.
     */
    public static EngineSettings defaults() {
        return EngineSettings.builder().build();
    }

    /**
     * Validates the settings and logs warnings for values that will give odd results.
     */
    public void validate() {
        if (irrTolerance <= 0) {
            log.warn("IRR tolerance ({}) should be positive", irrTolerance);
        }

        if (irrMaxIterations <= 0) {
            log.warn("IRR max iterations ({}) should be positive", irrMaxIterations);
        }

        if (irrLowerBound >= irrUpperBound) {
            log.warn("IRR lower bound ({}) should be below upper bound ({})", irrLowerBound, irrUpperBound);
        }

        if (irrInitialGuess <= irrLowerBound || irrInitialGuess >= irrUpperBound) {
            log.warn("IRR initial guess ({}) lies outside the solver bounds ({}, {})",
                    irrInitialGuess, irrLowerBound, irrUpperBound);
        }

        if (affordabilityLimitPercent <= 0 || affordabilityLimitPercent > 100) {
            log.warn("Affordability limit ({}%) should be between 0 and 100", affordabilityLimitPercent);
        }

        if (defaultForecastMonths < 1 || defaultForecastMonths > 60) {
            log.warn("Default forecast months ({}) should be between 1 and 60", defaultForecastMonths);
        }

        if (bestCaseMultiplier < 1.0) {
            log.warn("Best case multiplier ({}) should not be below 1.0", bestCaseMultiplier);
        }

        if (worstCaseMultiplier > 1.0 || worstCaseMultiplier <= 0) {
            log.warn("Worst case multiplier ({}) should be in (0, 1.0]", worstCaseMultiplier);
        }

        if (sensitivityVariations == null || sensitivityVariations.isEmpty()) {
            log.warn("No sensitivity variations configured");
        } else if (!sensitivityVariations.contains(0.0)) {
            log.warn("Sensitivity variations {} do not include 0, the sweep will have no baseline column",
                    sensitivityVariations);
        }

        if (offloadTimeoutMillis <= 0) {
            log.warn("Offload timeout ({} ms) should be positive", offloadTimeoutMillis);
        }

        if (workerThreads <= 0) {
            log.warn("Worker threads ({}) should be positive", workerThreads);
        }

        if (runwayCriticalMonths >= runwayWarningMonths) {
            log.warn("Runway critical months ({}) should be below warning months ({})",
                    runwayCriticalMonths, runwayWarningMonths);
        }

        log.debug("Using settings - IRR guess: {}, affordability: {}%, scenarios: {}/{}, source: {}",
                irrInitialGuess, affordabilityLimitPercent, bestCaseMultiplier, worstCaseMultiplier, source);
    }

    /**
     * Returns a description of the current settings for user feedback.
     */
    public String getConfigurationSummary() {
        return String.format("Source: %s | Best/Worst: %.2f/%.2f | Affordability: %.1f%% | Forecast: %d months | Offload: >=%d months",
                source, bestCaseMultiplier, worstCaseMultiplier,
                affordabilityLimitPercent, defaultForecastMonths, offloadThresholdMonths);
    }
}
