package org.carball.fincalc.model.sensitivity;

import java.util.List;

public record SensitivityAnalysis(SensitivityMatrix matrix, List<TornadoEntry> tornado) {}
