package org.carball.fincalc.validation;

import org.carball.fincalc.model.breakeven.BreakEvenInput;
import org.carball.fincalc.model.cohort.CohortInput;
import org.carball.fincalc.model.composite.EfficiencyInputs;
import org.carball.fincalc.model.composite.FrictionInputs;
import org.carball.fincalc.model.composite.TechDebtInputs;
import org.carball.fincalc.model.employee.EmployeeInput;
import org.carball.fincalc.model.forecast.CashFlowForecastInput;
import org.carball.fincalc.model.forecast.MonthlyAmount;
import org.carball.fincalc.model.loan.LoanInput;
import org.carball.fincalc.model.marketing.MarketingInput;
import org.carball.fincalc.model.pricing.PricingInput;
import org.carball.fincalc.model.runway.RunwayInput;
import org.carball.fincalc.model.saas.SaasInput;
import org.carball.fincalc.model.scenario.ScenarioInput;

import java.util.List;

import static org.carball.fincalc.validation.NumericGuards.requireFinite;
import static org.carball.fincalc.validation.NumericGuards.requireNonNegative;
import static org.carball.fincalc.validation.NumericGuards.requirePositive;
import static org.carball.fincalc.validation.NumericGuards.requirePresent;
import static org.carball.fincalc.validation.NumericGuards.requireRange;

/**
 * Fail-fast validation for every calculation input. Values are never clamped:
 * the first violation raises {@link InvalidInputException} naming the field.
 */
public final class InputValidator {

    public static final double MAX_RATE_PERCENT = 100;
    public static final double MIN_GROWTH_PERCENT = -100;
    public static final double MAX_GROWTH_PERCENT = 1000;
    public static final int MAX_PROJECT_MONTHS = 600;
    public static final int MAX_LOAN_TERM_MONTHS = 360;
    public static final double MAX_ORIGINATION_FEE_PERCENT = 10;
    public static final int MAX_FORECAST_MONTHS = 60;
    public static final double MIN_SEASONAL_FACTOR = 0.1;
    public static final double MAX_SEASONAL_FACTOR = 3.0;
    public static final double MAX_DESIRED_MARGIN_PERCENT = 99;
    public static final double MAX_HOURS_PER_WEEK = 80;
    public static final double MIN_PROFIT_MARGIN_PERCENT = -100;

    private InputValidator() {
    }

    public static void validate(ScenarioInput input) {
        requirePresent(input, "scenario");
        requirePositive(input.getInitialInvestment(), "initialInvestment");
        requireRange(input.getDiscountRate(), 0, MAX_RATE_PERCENT, "discountRate");
        requireRange(input.getProjectDuration(), 1, MAX_PROJECT_MONTHS, "projectDuration");
        requirePositive(input.getYearlyRevenue(), "yearlyRevenue");
        requireRange(input.getRevenueGrowth(), MIN_GROWTH_PERCENT, MAX_GROWTH_PERCENT, "revenueGrowth");
        requirePositive(input.getOperatingCosts(), "operatingCosts");
        requirePositive(input.getMaintenanceCosts(), "maintenanceCosts");
        requirePositive(input.getMultiplier(), "multiplier");
    }

    public static void validate(LoanInput input) {
        requirePresent(input, "loan");
        requirePositive(input.getPrincipal(), "principal");
        requireRange(input.getAnnualInterestRate(), 0, MAX_RATE_PERCENT, "annualInterestRate");
        requireRange(input.getTermMonths(), 1, MAX_LOAN_TERM_MONTHS, "termMonths");
        if (input.getOriginationFeePercent() != null) {
            requireRange(input.getOriginationFeePercent(), 0, MAX_ORIGINATION_FEE_PERCENT, "originationFeePercent");
        }
        if (input.getMonthlyRevenue() != null) {
            requireNonNegative(input.getMonthlyRevenue(), "monthlyRevenue");
        }
        if (input.getMonthlyExpenses() != null) {
            requireNonNegative(input.getMonthlyExpenses(), "monthlyExpenses");
        }
    }

    public static void validate(CashFlowForecastInput input) {
        requirePresent(input, "forecast");
        requireFinite(input.getStartingCash(), "startingCash");
        requirePositive(input.getMonthlyRevenue(), "monthlyRevenue");
        requirePositive(input.getMonthlyExpenses(), "monthlyExpenses");
        requireRange(input.getRevenueGrowthRate(), MIN_GROWTH_PERCENT, MAX_GROWTH_PERCENT, "revenueGrowthRate");
        requireRange(input.getExpenseGrowthRate(), MIN_GROWTH_PERCENT, MAX_GROWTH_PERCENT, "expenseGrowthRate");

        if (input.getForecastMonths() != null) {
            requireRange(input.getForecastMonths(), 1, MAX_FORECAST_MONTHS, "forecastMonths");
        }

        List<Double> factors = input.getSeasonalFactors();
        if (factors.size() > 12) {
            throw new InvalidInputException("seasonalFactors", "must have at most 12 entries, got " + factors.size());
        }
        for (int i = 0; i < factors.size(); i++) {
            String field = "seasonalFactors[" + i + "]";
            requireRange(requirePresent(factors.get(i), field), MIN_SEASONAL_FACTOR, MAX_SEASONAL_FACTOR, field);
        }

        validateMonthlyAmounts(input.getOneTimeExpenses(), "oneTimeExpenses");
        validateMonthlyAmounts(input.getExpectedReceivables(), "expectedReceivables");
    }

    public static void validate(FrictionInputs input) {
        requirePositive(input.getManualHoursPerWeek(), "manualHoursPerWeek");
        requirePositive(input.getHourlyCost(), "hourlyCost");
        requirePositive(input.getCurrentRevenue(), "currentRevenue");
    }

    public static void validate(TechDebtInputs input) {
        requirePositive(input.getMaintenanceHoursPerSprint(), "maintenanceHoursPerSprint");
        requirePositive(input.getTotalDevHoursPerSprint(), "totalDevHoursPerSprint");
        requirePositive(input.getTeamAnnualCost(), "teamAnnualCost");
        requirePositive(input.getIncidentCostPerMonth(), "incidentCostPerMonth");
        if (input.getMaintenanceHoursPerSprint() > input.getTotalDevHoursPerSprint()) {
            throw new InvalidInputException("maintenanceHoursPerSprint",
                    "must not exceed totalDevHoursPerSprint (" + input.getMaintenanceHoursPerSprint()
                            + " > " + input.getTotalDevHoursPerSprint() + ")");
        }
    }

    public static void validate(EfficiencyInputs input) {
        requirePositive(input.getCurrentRevenue(), "currentRevenue");
        requirePositive(input.getPreviousRevenue(), "previousRevenue");
        requirePositive(input.getCurrentBurnRate(), "currentBurnRate");
        requirePositive(input.getPreviousBurnRate(), "previousBurnRate");
    }

    public static void validate(BreakEvenInput input) {
        requirePresent(input, "breakEven");
        requirePositive(input.getFixedCosts(), "fixedCosts");
        requirePositive(input.getPricePerUnit(), "pricePerUnit");
        requireNonNegative(input.getVariableCostPerUnit(), "variableCostPerUnit");
        if (input.getPricePerUnit() <= input.getVariableCostPerUnit()) {
            throw new InvalidInputException("pricePerUnit",
                    "must be greater than variableCostPerUnit (" + input.getPricePerUnit()
                            + " <= " + input.getVariableCostPerUnit() + ")");
        }
        if (input.getCurrentSalesUnits() != null) {
            requireNonNegative(input.getCurrentSalesUnits(), "currentSalesUnits");
        }
        requireRange(input.getPeriodMonths(), 1, MAX_PROJECT_MONTHS, "periodMonths");
    }

    public static void validate(RunwayInput input) {
        requirePresent(input, "runway");
        requireNonNegative(input.getCurrentCash(), "currentCash");
        requirePositive(input.getMonthlyBurnRate(), "monthlyBurnRate");
        if (input.getPlannedFundraising() != null) {
            requireNonNegative(input.getPlannedFundraising(), "plannedFundraising");
        }
        requireRange(input.getMonthlyChurnRate(), 0, MAX_RATE_PERCENT, "monthlyChurnRate");
    }

    public static void validate(PricingInput input) {
        requirePresent(input, "pricing");
        requirePositive(input.getCostPerUnit(), "costPerUnit");
        requireRange(input.getDesiredMargin(), 0, MAX_DESIRED_MARGIN_PERCENT, "desiredMargin");
        if (input.getCompetitorPrice() != null) {
            requirePositive(input.getCompetitorPrice(), "competitorPrice");
        }
        if (input.getTargetVolume() != null) {
            requirePositive(input.getTargetVolume(), "targetVolume");
        }
        if (input.getFixedCostsPerPeriod() != null) {
            requireNonNegative(input.getFixedCostsPerPeriod(), "fixedCostsPerPeriod");
        }
    }

    public static void validate(MarketingInput input) {
        requirePresent(input, "campaign");
        requirePositive(input.getTotalSpend(), "totalSpend");
        requireNonNegative(input.getConversions(), "conversions");
        requirePositive(input.getRevenuePerConversion(), "revenuePerConversion");
        requirePresent(input.getChannel(), "channel");
        if (input.getImpressions() != null) {
            requireNonNegative(input.getImpressions(), "impressions");
        }
        if (input.getClicks() != null) {
            requireNonNegative(input.getClicks(), "clicks");
        }
    }

    public static void validate(EmployeeInput input) {
        requirePresent(input, "employee");
        requirePositive(input.getAnnualSalary(), "annualSalary");
        requireNonNegative(input.getAnnualBenefits(), "annualBenefits");
        requireNonNegative(input.getOnboardingCosts(), "onboardingCosts");
        requireNonNegative(input.getRevenueGenerated(), "revenueGenerated");
        requireRange(input.getHoursPerWeek(), 1, MAX_HOURS_PER_WEEK, "hoursPerWeek");
        requirePresent(input.getRoleType(), "roleType");
    }

    public static void validate(SaasInput input) {
        requirePresent(input, "saas");
        requirePositive(input.getAverageRevenuePerUser(), "averageRevenuePerUser");
        requireRange(input.getChurnRate(), 0, MAX_RATE_PERCENT, "churnRate");
        requirePositive(input.getCacCost(), "cacCost");
        requireRange(input.getGrossMargin(), 0, MAX_RATE_PERCENT, "grossMargin");
        requirePositive(input.getStartingMrr(), "startingMrr");
        requireNonNegative(input.getExpansionMrr(), "expansionMrr");
        requireNonNegative(input.getChurnedMrr(), "churnedMrr");
        requireNonNegative(input.getContractedMrr(), "contractedMrr");
        requireRange(input.getRevenueGrowthRate(), MIN_GROWTH_PERCENT, MAX_GROWTH_PERCENT, "revenueGrowthRate");
        requireRange(input.getProfitMargin(), MIN_PROFIT_MARGIN_PERCENT, MAX_RATE_PERCENT, "profitMargin");
    }

    public static void validate(CohortInput input) {
        requirePresent(input, "cohort");
        if (input.getCohortName() == null || input.getCohortName().isBlank()) {
            throw new InvalidInputException("cohortName", "is required");
        }
        requirePositive(input.getCohortRevenue(), "cohortRevenue");
        requireNonNegative(input.getDirectCosts(), "directCosts");
        requirePositive(input.getCustomerCount(), "customerCount");
        requireNonNegative(input.getAcquisitionCost(), "acquisitionCost");
        requireNonNegative(input.getServicingCostPerCustomer(), "servicingCostPerCustomer");
    }

    private static void validateMonthlyAmounts(List<MonthlyAmount> amounts, String field) {
        for (int i = 0; i < amounts.size(); i++) {
            MonthlyAmount amount = requirePresent(amounts.get(i), field + "[" + i + "]");
            requireRange(amount.getMonth(), 1, MAX_FORECAST_MONTHS, field + "[" + i + "].month");
            requireNonNegative(amount.getAmount(), field + "[" + i + "].amount");
        }
    }
}
