package org.carball.fincalc.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads settings using the hierarchy: CLI args > env vars > defaults
     */
    public EngineSettings loadConfiguration(String[] args) {
        return loadConfiguration(null, args);
    }

    /**
     * Loads settings using the hierarchy: CLI args > env vars > settings file > defaults
     */
    public EngineSettings loadConfiguration(Path settingsFile, String[] args) {
        log.debug("Loading engine settings");

        EngineSettings.EngineSettingsBuilder builder = loadSettingsFile(settingsFile).toBuilder();

        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        EngineSettings settings = builder.build();
        settings.validate();

        log.info("Configuration loaded: {}", settings.getConfigurationSummary());
        return settings;
    }

    /**
     * Reads a YAML settings file. A missing or unreadable file falls back to defaults.
     */
    public EngineSettings loadSettingsFile(Path settingsFile) {
        if (settingsFile == null) {
            return EngineSettings.defaults();
        }

        if (!Files.exists(settingsFile)) {
            log.warn("Settings file not found: {}, using defaults", settingsFile);
            return EngineSettings.defaults();
        }

        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            EngineSettings settings = mapper.readValue(settingsFile.toFile(), EngineSettings.class);
            log.info("Loaded settings from: {}", settingsFile);
            return settings.toBuilder().source(settingsFile.getFileName().toString()).build();
        } catch (IOException e) {
            log.error("Failed to load settings from {}: {}, using defaults", settingsFile, e.getMessage());
            return EngineSettings.defaults();
        }
    }

    private void applyEnvironmentVariables(EngineSettings.EngineSettingsBuilder builder) {
        applyEnv("FINCALC_IRR_INITIAL_GUESS", v -> builder.irrInitialGuess(Double.parseDouble(v)));
        applyEnv("FINCALC_IRR_TOLERANCE", v -> builder.irrTolerance(Double.parseDouble(v)));
        applyEnv("FINCALC_IRR_MAX_ITERATIONS", v -> builder.irrMaxIterations(Integer.parseInt(v)));
        applyEnv("FINCALC_AFFORDABILITY_LIMIT", v -> builder.affordabilityLimitPercent(Double.parseDouble(v)));
        applyEnv("FINCALC_FORECAST_MONTHS", v -> builder.defaultForecastMonths(Integer.parseInt(v)));
        applyEnv("FINCALC_BEST_CASE_MULTIPLIER", v -> builder.bestCaseMultiplier(Double.parseDouble(v)));
        applyEnv("FINCALC_WORST_CASE_MULTIPLIER", v -> builder.worstCaseMultiplier(Double.parseDouble(v)));
        applyEnv("FINCALC_SENSITIVITY_VARIATIONS", v -> builder.sensitivityVariations(parseVariations(v)));
        applyEnv("FINCALC_OFFLOAD_THRESHOLD_MONTHS", v -> builder.offloadThresholdMonths(Integer.parseInt(v)));
        applyEnv("FINCALC_OFFLOAD_TIMEOUT_MILLIS", v -> builder.offloadTimeoutMillis(Long.parseLong(v)));
        applyEnv("FINCALC_WORKER_THREADS", v -> builder.workerThreads(Integer.parseInt(v)));
    }

    private void applyEnv(String name, Consumer<String> setter) {
        String value = environment.get(name);
        if (value == null) {
            return;
        }
        try {
            setter.accept(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", name, value);
        }
    }

    private void applyCLIArguments(EngineSettings.EngineSettingsBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--engine.irr-initial-guess":
                        builder.irrInitialGuess(Double.parseDouble(value));
                        break;
                    case "--engine.irr-tolerance":
                        builder.irrTolerance(Double.parseDouble(value));
                        break;
                    case "--engine.irr-max-iterations":
                        builder.irrMaxIterations(Integer.parseInt(value));
                        break;
                    case "--engine.affordability-limit":
                        builder.affordabilityLimitPercent(Double.parseDouble(value));
                        break;
                    case "--engine.forecast-months":
                        builder.defaultForecastMonths(Integer.parseInt(value));
                        break;
                    case "--engine.best-case":
                        builder.bestCaseMultiplier(Double.parseDouble(value));
                        break;
                    case "--engine.worst-case":
                        builder.worstCaseMultiplier(Double.parseDouble(value));
                        break;
                    case "--engine.sensitivity-variations":
                        builder.sensitivityVariations(parseVariations(value));
                        break;
                    case "--engine.offload-threshold":
                        builder.offloadThresholdMonths(Integer.parseInt(value));
                        break;
                    case "--engine.offload-timeout":
                        builder.offloadTimeoutMillis(Long.parseLong(value));
                        break;
                    case "--engine.worker-threads":
                        builder.workerThreads(Integer.parseInt(value));
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    private static List<Double> parseVariations(String value) {
        List<Double> variations = new ArrayList<>();
        for (String part : value.split(",")) {
            if (!part.isBlank()) {
                variations.add(Double.parseDouble(part.trim()));
            }
        }
        return List.copyOf(variations);
    }

    /**
     * Returns help text for engine configuration options.
     */
    public static String getSettingsHelp() {
        return """
            Engine Configuration Options:

            CLI Arguments:
              --engine.irr-initial-guess <num>      Monthly rate the IRR solver starts from
              --engine.irr-tolerance <num>          |NPV| below which the IRR is accepted
              --engine.irr-max-iterations <num>     Newton-Raphson iteration cap
              --engine.affordability-limit <num>    Max debt service ratio (%) for an affordable loan
              --engine.forecast-months <num>        Forecast length when the input gives none
              --engine.best-case <num>              Revenue multiplier for the best case
              --engine.worst-case <num>             Revenue multiplier for the worst case
              --engine.sensitivity-variations <list> Comma separated percents, e.g. -20,-10,0,10,20
              --engine.offload-threshold <num>      Duration (months) from which scenarios run on a worker
              --engine.offload-timeout <num>        Worker timeout in milliseconds
              --engine.worker-threads <num>         Worker pool size

            Environment Variables:
              FINCALC_IRR_INITIAL_GUESS             Same as --engine.irr-initial-guess
              FINCALC_IRR_TOLERANCE                 Same as --engine.irr-tolerance
              FINCALC_IRR_MAX_ITERATIONS            Same as --engine.irr-max-iterations
              FINCALC_AFFORDABILITY_LIMIT           Same as --engine.affordability-limit
              FINCALC_FORECAST_MONTHS               Same as --engine.forecast-months
              FINCALC_BEST_CASE_MULTIPLIER          Same as --engine.best-case
              FINCALC_WORST_CASE_MULTIPLIER         Same as --engine.worst-case
              FINCALC_SENSITIVITY_VARIATIONS        Same as --engine.sensitivity-variations
              FINCALC_OFFLOAD_THRESHOLD_MONTHS      Same as --engine.offload-threshold
              FINCALC_OFFLOAD_TIMEOUT_MILLIS        Same as --engine.offload-timeout
              FINCALC_WORKER_THREADS                Same as --engine.worker-threads

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Settings file (--settings <file.yml>)
              4. Built-in defaults
            """;
    }
}
