package org.carball.fincalc.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.carball.fincalc.engine.StandardMetricsEngine;

import java.util.concurrent.Callable;

/**
 * Runs one scenario off the caller's thread. Failures come back as an error response.
 */
@Slf4j
@RequiredArgsConstructor
public class CalculationWorker implements Callable<CalculationResponse> {

    private final StandardMetricsEngine engine;
    private final CalculationRequest request;

    @Override
    public CalculationResponse call() {
        log.debug("Worker computing request {} ({} months)", request.requestId(), request.input().getProjectDuration());
        try {
            return CalculationResponse.success(request.requestId(), engine.calculate(request.input()));
        } catch (RuntimeException e) {
            log.debug("Worker failed request {}: {}", request.requestId(), e.getMessage());
            return CalculationResponse.failure(request.requestId(), e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
