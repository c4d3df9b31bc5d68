package org.carball.fincalc.model.benchmark;

public record Kpi(String name, String description, double targetValue, String unit) {}
