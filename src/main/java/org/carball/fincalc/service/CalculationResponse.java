package org.carball.fincalc.service;

import org.carball.fincalc.model.scenario.StandardMetricsResult;

/**
 * Worker reply carrying either a result or an error message, never both.
 */
public record CalculationResponse(String requestId, StandardMetricsResult result, String error) {

    public static CalculationResponse success(String requestId, StandardMetricsResult result) {
        return new CalculationResponse(requestId, result, null);
    }

    public static CalculationResponse failure(String requestId, String error) {
        return new CalculationResponse(requestId, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
