package org.carball.fincalc.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.fincalc.benchmark.BenchmarkComparator;
import org.carball.fincalc.config.CalculatorCommand;
import org.carball.fincalc.config.CalculatorOptions;
import org.carball.fincalc.config.ConfigurationLoader;
import org.carball.fincalc.config.EngineSettings;
import org.carball.fincalc.engine.AmortizationEngine;
import org.carball.fincalc.engine.BreakEvenEngine;
import org.carball.fincalc.engine.CashFlowForecastEngine;
import org.carball.fincalc.engine.CohortMetricsEngine;
import org.carball.fincalc.engine.CompositeIndexEngine;
import org.carball.fincalc.engine.EmployeeRoiEngine;
import org.carball.fincalc.engine.MarketingRoiEngine;
import org.carball.fincalc.engine.PricingEngine;
import org.carball.fincalc.engine.RunwayEngine;
import org.carball.fincalc.engine.SaasMetricsEngine;
import org.carball.fincalc.engine.SensitivityEngine;
import org.carball.fincalc.engine.StandardMetricsEngine;
import org.carball.fincalc.model.benchmark.HealthRequest;
import org.carball.fincalc.model.breakeven.BreakEvenInput;
import org.carball.fincalc.model.cohort.CohortInput;
import org.carball.fincalc.model.composite.CompositeInputs;
import org.carball.fincalc.model.employee.EmployeeInput;
import org.carball.fincalc.model.forecast.CashFlowForecastInput;
import org.carball.fincalc.model.loan.LoanInput;
import org.carball.fincalc.model.marketing.MarketingInput;
import org.carball.fincalc.model.pricing.PricingInput;
import org.carball.fincalc.model.runway.RunwayInput;
import org.carball.fincalc.model.saas.SaasInput;
import org.carball.fincalc.model.scenario.ScenarioInput;
import org.carball.fincalc.output.CalculationReport;
import org.carball.fincalc.service.OffloadedCalculationClient;
import org.carball.fincalc.service.ScenarioService;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;

@Slf4j
public class FinancialCalculatorCLI {

    private static final String VERSION = "1.0.0";

    private final PrintStream out;
    private final PrintStream err;
    private final ConfigurationLoader configurationLoader;
    private final Clock clock;

    public FinancialCalculatorCLI(PrintStream out, PrintStream err, ConfigurationLoader configurationLoader, Clock clock) {
        this.out = out;
        this.err = err;
        this.configurationLoader = configurationLoader;
        this.clock = clock;
    }

    public static void main(String[] args) {
        FinancialCalculatorCLI cli = new FinancialCalculatorCLI(System.out, System.err,
                new ConfigurationLoader(), Clock.systemDefaultZone());
        System.exit(cli.run(args));
    }

    /**
     * Runs one command and returns the process exit code.
     */
    public int run(String[] args) {
        if (isHelpRequested(args)) {
            printUsage();
            return 0;
        }
        if (Arrays.asList(args).contains("--help-settings")) {
            out.println(ConfigurationLoader.getSettingsHelp());
            return 0;
        }
        if (args.length < 2) {
            printUsage();
            return 1;
        }

        try {
            CalculatorOptions options = parseArgs(args);
            EngineSettings settings = configurationLoader.loadConfiguration(options.getSettingsFile(), args);

            if (options.isVerbose()) {
                err.println("Command: " + options.getCommand().getName());
                err.println("Input: " + options.getInputFile());
                err.println("Settings: " + settings.getConfigurationSummary());
            }

            if (!Files.exists(options.getInputFile())) {
                throw new IOException("Input file not found: " + options.getInputFile());
            }

            long start = System.nanoTime();
            CalculationReport report = execute(options, settings);

            if (options.getOutputFile() != null) {
                report.writeTo(options.getOutputFile());
                out.println("Report written to " + options.getOutputFile());
            } else {
                out.println(report.toJson());
            }

            if (options.isVerbose()) {
                err.printf("Completed in %d ms%n", (System.nanoTime() - start) / 1_000_000);
            }
            return 0;

        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println("Run with --help for usage information.");
            log.debug("Input error details", e);
            return 1;
        } catch (IOException e) {
            err.println("IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        } catch (Exception e) {
            err.println("Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return 1;
        }
    }

    private CalculationReport execute(CalculatorOptions options, EngineSettings settings) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        Path inputFile = options.getInputFile();
        CalculatorCommand command = options.getCommand();

        Object input;
        Object result;

        switch (command) {
            case METRICS: {
                ScenarioInput scenario = mapper.readValue(inputFile.toFile(), ScenarioInput.class);
                try (OffloadedCalculationClient client = new OffloadedCalculationClient(settings)) {
                    result = new ScenarioService(client, settings).calculate(scenario);
                }
                input = scenario;
                break;
            }
            case SCENARIOS: {
                ScenarioInput scenario = mapper.readValue(inputFile.toFile(), ScenarioInput.class);
                try (OffloadedCalculationClient client = new OffloadedCalculationClient(settings)) {
                    result = new ScenarioService(client, settings).calculateScenarios(scenario);
                }
                input = scenario;
                break;
            }
            case SENSITIVITY: {
                ScenarioInput scenario = mapper.readValue(inputFile.toFile(), ScenarioInput.class);
                result = new SensitivityEngine(settings).analyze(scenario);
                input = scenario;
                break;
            }
            case LOAN: {
                AmortizationEngine engine = new AmortizationEngine(settings);
                JsonNode root = mapper.readTree(inputFile.toFile());
                if (root != null && root.isArray()) {
                    List<LoanInput> loans = mapper.convertValue(root, new TypeReference<List<LoanInput>>() {});
                    result = engine.compare(loans);
                    input = loans;
                } else {
                    LoanInput loan = mapper.treeToValue(root, LoanInput.class);
                    result = engine.calculate(loan);
                    input = loan;
                }
                break;
            }
            case FORECAST: {
                CashFlowForecastInput forecast = mapper.readValue(inputFile.toFile(), CashFlowForecastInput.class);
                result = new CashFlowForecastEngine(settings).calculate(forecast);
                input = forecast;
                break;
            }
            case COMPOSITE: {
                CompositeInputs composite = mapper.readValue(inputFile.toFile(), CompositeInputs.class);
                result = new CompositeIndexEngine().calculate(composite);
                input = composite;
                break;
            }
            case BREAKEVEN: {
                BreakEvenInput breakEven = mapper.readValue(inputFile.toFile(), BreakEvenInput.class);
                result = new BreakEvenEngine().calculate(breakEven);
                input = breakEven;
                break;
            }
            case RUNWAY: {
                RunwayInput runway = mapper.readValue(inputFile.toFile(), RunwayInput.class);
                result = new RunwayEngine(settings, clock).calculate(runway);
                input = runway;
                break;
            }
            case HEALTH: {
                HealthRequest health = mapper.readValue(inputFile.toFile(), HealthRequest.class);
                if (health.getIndustry() == null) {
                    throw new IllegalArgumentException("industry is required");
                }
                result = new BenchmarkComparator().report(health.getIndustry(), health.typedMetrics());
                input = health;
                break;
            }
            case PRICING: {
                PricingInput pricing = mapper.readValue(inputFile.toFile(), PricingInput.class);
                result = new PricingEngine().calculate(pricing);
                input = pricing;
                break;
            }
            case MARKETING: {
                MarketingRoiEngine engine = new MarketingRoiEngine();
                JsonNode root = mapper.readTree(inputFile.toFile());
                if (root != null && root.isArray()) {
                    List<MarketingInput> campaigns = mapper.convertValue(root, new TypeReference<List<MarketingInput>>() {});
                    result = engine.compareChannels(campaigns);
                    input = campaigns;
                } else {
                    MarketingInput campaign = mapper.treeToValue(root, MarketingInput.class);
                    result = engine.calculate(campaign);
                    input = campaign;
                }
                break;
            }
            case EMPLOYEE: {
                EmployeeInput employee = mapper.readValue(inputFile.toFile(), EmployeeInput.class);
                result = new EmployeeRoiEngine().calculate(employee);
                input = employee;
                break;
            }
            case SAAS: {
                SaasInput saas = mapper.readValue(inputFile.toFile(), SaasInput.class);
                result = new SaasMetricsEngine().calculate(saas);
                input = saas;
                break;
            }
            case COHORT: {
                CohortInput cohort = mapper.readValue(inputFile.toFile(), CohortInput.class);
                result = new CohortMetricsEngine().calculate(cohort);
                input = cohort;
                break;
            }
            default:
                throw new IllegalArgumentException("Unsupported command: " + command);
        }

        log.info("Completed {} calculation for {}", command.getName(), inputFile.getFileName());
        return new CalculationReport(command.getName(), input, result, settings, clock);
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                (args.length > 0 && "help".equals(args[0]));
    }

    static CalculatorOptions parseArgs(String[] args) {
        CalculatorOptions options = new CalculatorOptions();
        options.setCommand(CalculatorCommand.fromName(args[0]));
        options.setInputFile(Paths.get(args[1]));
        options.setVerbose(false);

        for (int i = 2; i < args.length; i++) {
            switch (args[i]) {
                case "--output":
                case "-o":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Output file not specified");
                    }
                    options.setOutputFile(Paths.get(args[++i]));
                    break;

                case "--settings":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Settings file not specified");
                    }
                    options.setSettingsFile(Paths.get(args[++i]));
                    break;

                case "--verbose":
                case "-v":
                    options.setVerbose(true);
                    break;

                default:
                    if (args[i].startsWith("--engine.")) {
                        if (i + 1 >= args.length) {
                            throw new IllegalArgumentException("Value not specified for " + args[i]);
                        }
                        // Value is applied by ConfigurationLoader
                        i++;
                        break;
                    }
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        return options;
    }

    private void printUsage() {
        out.println("Financial Calculator v" + VERSION);
        out.println();
        out.println("Usage: java -jar fincalc.jar <command> <input-file> [options]");
        out.println();
        out.println("Commands:");
        for (CalculatorCommand command : CalculatorCommand.values()) {
            out.printf("  %-13s %s%n", command.getName(), command.getDescription());
        }
        out.println();
        out.println("Arguments:");
        out.println("  input-file    YAML or JSON file with the calculation inputs");
        out.println("                (the loan command also accepts a list of loans to compare,");
        out.println("                 the marketing command a list of campaigns)");
        out.println();
        out.println("Options:");
        out.println("  --output, -o <file>     Write the JSON report to a file instead of stdout");
        out.println("  --settings <file>       YAML file with engine settings");
        out.println("  --engine.<name> <value> Override one engine setting (see --help-settings)");
        out.println("  --verbose, -v           Print settings and timing to stderr");
        out.println("  --help, -h              Show this help message");
        out.println();
        out.println("Examples:");
        out.println("  java -jar fincalc.jar metrics project.yml");
        out.println("  java -jar fincalc.jar loan loans.json --output loan-report.json");
        out.println("  java -jar fincalc.jar scenarios project.yml --engine.best-case 1.5");
    }
}
