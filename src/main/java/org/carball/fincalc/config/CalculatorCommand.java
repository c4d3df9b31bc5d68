package org.carball.fincalc.config;

import lombok.Getter;

@Getter
public enum CalculatorCommand {

    METRICS("metrics", "ROI, NPV, IRR and payback for a scenario"),
    SCENARIOS("scenarios", "Expected, best and worst case for a scenario"),
    SENSITIVITY("sensitivity", "Sensitivity matrix and NPV tornado for a scenario"),
    LOAN("loan", "Loan payment, amortization schedule and affordability"),
    FORECAST("forecast", "Month-by-month cash flow forecast"),
    COMPOSITE("composite", "OFI, TFDI and SER indices"),
    BREAKEVEN("breakeven", "Break-even units, revenue and margin of safety"),
    RUNWAY("runway", "Cash runway, zero-cash date and churn impact"),
    HEALTH("health", "Industry health score and benchmark comparison"),
    PRICING("pricing", "Target-margin price, competitor position and price strategies"),
    MARKETING("marketing", "Campaign ROI, ROAS and CAC, or a channel comparison"),
    EMPLOYEE("employee", "First-year ROI and productivity of a hire"),
    SAAS("saas", "LTV/CAC, CAC payback, net revenue retention and rule of 40"),
    COHORT("cohort", "Contribution margin and profitability index of a cohort");

    private final String name;
    private final String description;

    CalculatorCommand(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public static CalculatorCommand fromName(String name) {
        for (CalculatorCommand command : values()) {
            if (command.getName().equalsIgnoreCase(name)) {
                return command;
            }
        }
        throw new IllegalArgumentException("Unknown command: " + name + ". Available commands: " + getAvailableCommands());
    }

    public static String getAvailableCommands() {
        StringBuilder sb = new StringBuilder();
        for (CalculatorCommand command : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(command.getName());
        }
        return sb.toString();
    }
}
