package org.carball.fincalc.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.fincalc.config.EngineSettings;
import org.carball.fincalc.model.loan.Affordability;
import org.carball.fincalc.model.loan.AmortizationEntry;
import org.carball.fincalc.model.loan.LoanAnalysis;
import org.carball.fincalc.model.loan.LoanComparison;
import org.carball.fincalc.model.loan.LoanInput;
import org.carball.fincalc.model.loan.LoanOption;
import org.carball.fincalc.validation.InputValidator;

import java.util.ArrayList;
import java.util.List;

import static org.carball.fincalc.validation.NumericGuards.roundCurrency;

/**
 * Fixed-payment loan analysis with a full amortization schedule.
 */
@Slf4j
public class AmortizationEngine {

    private final EngineSettings settings;

    public AmortizationEngine() {
        this(EngineSettings.defaults());
    }

    public AmortizationEngine(EngineSettings settings) {
        this.settings = settings;
    }

    public LoanAnalysis calculate(LoanInput input) {
        InputValidator.validate(input);

        double principal = input.getPrincipal();
        int termMonths = input.getTermMonths();
        double monthlyRate = input.getAnnualInterestRate() / 100 / 12;

        double monthlyPayment = monthlyPayment(principal, monthlyRate, termMonths);
        List<AmortizationEntry> schedule = schedule(principal, monthlyRate, termMonths, monthlyPayment);

        double totalPayment = monthlyPayment * termMonths;
        double totalInterest = totalPayment - principal;

        double feePercent = input.getOriginationFeePercent() == null ? 0 : input.getOriginationFeePercent();
        double fees = principal * feePercent / 100;
        double totalCostWithFees = totalPayment + fees;
        double effectiveAnnualRate = effectiveAnnualRate(principal - fees, totalPayment, termMonths);

        double firstYearPrincipal = 0;
        double firstYearInterest = 0;
        for (AmortizationEntry entry : schedule.subList(0, Math.min(12, termMonths))) {
            firstYearPrincipal += entry.principal();
            firstYearInterest += entry.interest();
        }

        int halfwayMonth = termMonths / 2;
        double balanceAtHalfway = halfwayMonth > 0 ? schedule.get(halfwayMonth - 1).balance() : 0;

        Affordability affordability = affordability(input, monthlyPayment);

        log.debug("Monthly payment: {}", monthlyPayment);
        log.debug("Total interest: {}", totalInterest);
        log.debug("Effective annual rate (%): {}", effectiveAnnualRate);

        return new LoanAnalysis(
                roundCurrency(monthlyPayment),
                roundCurrency(totalPayment),
                roundCurrency(totalInterest),
                roundCurrency(effectiveAnnualRate),
                roundCurrency(totalCostWithFees),
                schedule,
                roundCurrency(firstYearPrincipal),
                roundCurrency(firstYearInterest),
                affordability,
                halfwayMonth,
                balanceAtHalfway);
    }

    /**
     * Analyses each option and picks the one with the lowest total cost including fees.
     */
    public LoanComparison compare(List<LoanInput> inputs) {
        if (inputs == null || inputs.isEmpty()) {
            throw new IllegalArgumentException("At least one loan option is required");
        }

        List<LoanOption> options = new ArrayList<>(inputs.size());
        int bestIndex = 0;
        double cheapest = Double.MAX_VALUE;
        double dearest = -Double.MAX_VALUE;

        for (int i = 0; i < inputs.size(); i++) {
            LoanAnalysis analysis = calculate(inputs.get(i));
            options.add(new LoanOption(inputs.get(i), analysis.monthlyPayment(), analysis.totalCostWithFees()));

            if (analysis.totalCostWithFees() < cheapest) {
                cheapest = analysis.totalCostWithFees();
                bestIndex = i;
            }
            dearest = Math.max(dearest, analysis.totalCostWithFees());
        }

        log.info("Compared {} loan options, best is #{} saving {}", options.size(), bestIndex, dearest - cheapest);
        return new LoanComparison(List.copyOf(options), bestIndex, roundCurrency(dearest - cheapest));
    }

    static double monthlyPayment(double principal, double monthlyRate, int termMonths) {
        if (monthlyRate == 0) {
            return principal / termMonths;
        }
        double growth = Math.pow(1 + monthlyRate, termMonths);
        return principal * monthlyRate * growth / (growth - 1);
    }

    /**
     * Each entry's principal is the drop in the rounded balance, so the rounded principals
     * sum to the loan amount. The last month pays off whatever is left.
     */
    private List<AmortizationEntry> schedule(double principal, double monthlyRate, int termMonths,
                                             double monthlyPayment) {
        List<AmortizationEntry> schedule = new ArrayList<>(termMonths);
        double balance = principal;
        double previousRounded = roundCurrency(principal);

        for (int month = 1; month <= termMonths; month++) {
            double interest = balance * monthlyRate;
            balance -= monthlyPayment - interest;

            if (month == termMonths) {
                double finalInterest = roundCurrency(interest);
                schedule.add(new AmortizationEntry(month,
                        roundCurrency(previousRounded + finalInterest),
                        previousRounded,
                        finalInterest,
                        0));
                break;
            }

            double roundedBalance = roundCurrency(Math.max(0, balance));
            schedule.add(new AmortizationEntry(month,
                    roundCurrency(monthlyPayment),
                    roundCurrency(previousRounded - roundedBalance),
                    roundCurrency(interest),
                    roundedBalance));
            previousRounded = roundedBalance;
        }
        return List.copyOf(schedule);
    }

    // Straight-line approximation over the average balance, not an exact APR
    private static double effectiveAnnualRate(double netProceeds, double totalPaid, int termMonths) {
        double averageBalance = netProceeds / 2;
        double years = termMonths / 12.0;
        return (totalPaid - netProceeds) / averageBalance / years * 100;
    }

    private Affordability affordability(LoanInput input, double monthlyPayment) {
        if (!input.hasOperatingFigures()) {
            return Affordability.unknown();
        }

        double netCashFlow = input.getMonthlyRevenue() - input.getMonthlyExpenses();
        double cushion = roundCurrency(netCashFlow - monthlyPayment);
        if (netCashFlow <= 0) {
            log.debug("No positive operating cash flow ({}), loan is not affordable", netCashFlow);
            return new Affordability(null, false, 0.0, cushion);
        }

        double limit = settings.getAffordabilityLimitPercent();
        double debtServiceRatio = monthlyPayment / netCashFlow * 100;
        return new Affordability(
                roundCurrency(debtServiceRatio),
                debtServiceRatio <= limit,
                roundCurrency(netCashFlow * limit / 100),
                cushion);
    }
}
