package org.carball.fincalc.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.fincalc.model.employee.CostEfficiency;
import org.carball.fincalc.model.employee.EmployeeInput;
import org.carball.fincalc.model.employee.EmployeeRoiResult;
import org.carball.fincalc.model.employee.ProductivityLevel;
import org.carball.fincalc.model.employee.RoleType;
import org.carball.fincalc.model.employee.SalaryRange;
import org.carball.fincalc.validation.InputValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.carball.fincalc.validation.NumericGuards.requirePositive;
import static org.carball.fincalc.validation.NumericGuards.requireRange;
import static org.carball.fincalc.validation.NumericGuards.round;
import static org.carball.fincalc.validation.NumericGuards.roundCurrency;
import static org.carball.fincalc.validation.NumericGuards.safeDivide;

/**
 * First-year return on a hire and the salary band a revenue target can carry.
 */
@Slf4j
public class EmployeeRoiEngine {

    private static final int WEEKS_PER_YEAR = 52;
    private static final double DEFAULT_TARGET_ROI_PERCENT = 50;
    private static final double ASSUMED_BENEFITS_RATIO = 0.20;
    private static final double SALARY_RANGE_FLOOR = 0.85;

    public EmployeeRoiResult calculate(EmployeeInput input) {
        InputValidator.validate(input);

        double recurringCost = input.getAnnualSalary() + input.getAnnualBenefits();
        double totalCost = recurringCost + input.getOnboardingCosts();
        double revenue = input.getRevenueGenerated();

        double netContribution = revenue - totalCost;
        double roi = netContribution / totalCost * 100;
        double revenuePerDollar = revenue / totalCost;

        double annualHours = input.getHoursPerWeek() * WEEKS_PER_YEAR;
        double costPerHour = recurringCost / annualHours;
        double revenuePerHour = revenue / annualHours;
        double productivity = safeDivide(revenuePerHour, costPerHour);

        boolean worthHiring = roi > 0 && productivity > 1;

        Double paybackMonths = null;
        if (netContribution > 0) {
            paybackMonths = round(input.getOnboardingCosts() / (netContribution / 12), 1);
        }

        RoleType role = input.getRoleType();
        CostEfficiency costEfficiency = costEfficiency(costPerHour, role);
        ProductivityLevel productivityLevel = productivityLevel(productivity, role);

        log.debug("Employee ROI (%): {}", roi);
        log.debug("Productivity ratio: {}", productivity);
        log.debug("Net contribution: {}", netContribution);

        return new EmployeeRoiResult(
                roundCurrency(totalCost),
                roundCurrency(roi),
                roundCurrency(netContribution),
                roundCurrency(revenuePerDollar),
                roundCurrency(costPerHour),
                roundCurrency(revenuePerHour),
                roundCurrency(totalCost),
                roundCurrency(productivity),
                worthHiring,
                paybackMonths,
                costEfficiency,
                productivityLevel,
                recommendations(worthHiring, roi, revenuePerDollar, productivityLevel, paybackMonths));
    }

    public SalaryRange optimalSalaryRange(double expectedRevenue) {
        return optimalSalaryRange(expectedRevenue, DEFAULT_TARGET_ROI_PERCENT);
    }

    /**
     * Largest first-year cost that still returns {@code targetRoi} percent, split into salary
     * and benefits at a 20% benefits load. The band spans 85% to 100% of that salary.
     */
    public SalaryRange optimalSalaryRange(double expectedRevenue, double targetRoi) {
        requirePositive(expectedRevenue, "expectedRevenue");
        requireRange(targetRoi, 0, InputValidator.MAX_GROWTH_PERCENT, "targetRoi");

        double maxTotalCost = expectedRevenue / (1 + targetRoi / 100);
        double salary = maxTotalCost / (1 + ASSUMED_BENEFITS_RATIO);

        return new SalaryRange(
                round(maxTotalCost, 0),
                round(salary * SALARY_RANGE_FLOOR, 0),
                round(salary, 0),
                ASSUMED_BENEFITS_RATIO);
    }

    static CostEfficiency costEfficiency(double costPerHour, RoleType role) {
        double average = role.getAverageCostPerHour();
        if (costPerHour < average * 0.9) {
            return CostEfficiency.ABOVE;
        } else if (costPerHour > average * 1.1) {
            return CostEfficiency.BELOW;
        }
        return CostEfficiency.AVERAGE;
    }

    static ProductivityLevel productivityLevel(double productivity, RoleType role) {
        double average = role.getAverageProductivity();
        if (productivity > average * 1.2) {
            return ProductivityLevel.HIGH;
        } else if (productivity < average * 0.8) {
            return ProductivityLevel.LOW;
        }
        return ProductivityLevel.AVERAGE;
    }

    private static List<String> recommendations(boolean worthHiring, double roi, double revenuePerDollar,
                                                ProductivityLevel productivity, Double paybackMonths) {
        List<String> recommendations = new ArrayList<>();

        if (!worthHiring) {
            recommendations.add("This hire may not generate a positive return on the projected revenue.");
            recommendations.add("Check whether better tools or training would let the role generate more revenue.");
        } else {
            recommendations.add(String.format(Locale.ROOT, "Positive ROI: the hire generates %.2f for every 1 spent.", revenuePerDollar));
        }

        if (roi > 100) {
            recommendations.add("Excellent ROI. Consider hiring more people in similar roles.");
        } else if (roi > 50) {
            recommendations.add("Good ROI. This is a valuable team member.");
        } else if (roi > 0) {
            recommendations.add("Moderate ROI. Look for ways to raise productivity or reduce costs.");
        }

        if (productivity == ProductivityLevel.HIGH) {
            recommendations.add("Productivity is above the role average.");
        } else if (productivity == ProductivityLevel.LOW) {
            recommendations.add("Productivity is below the role average. Consider training or process improvements.");
        }

        if (paybackMonths != null) {
            recommendations.add(String.format(Locale.ROOT, "Onboarding cost is recovered in %.1f months.", paybackMonths));
        }
        return List.copyOf(recommendations);
    }
}
