package org.carball.fincalc.config;

import lombok.Data;

import java.nio.file.Path;

@Data
public class CalculatorOptions {
    private CalculatorCommand command;
    private Path inputFile;
    private Path outputFile;
    private Path settingsFile;
    private boolean verbose;
}
