package org.carball.fincalc.service;

import org.carball.fincalc.model.scenario.ScenarioInput;

public record CalculationRequest(String requestId, ScenarioInput input) {}
