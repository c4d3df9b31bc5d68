package org.carball.fincalc.model.benchmark;

public record TemplateBand(double min, double max, double optimal) {}
