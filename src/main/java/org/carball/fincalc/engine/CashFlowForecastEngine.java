package org.carball.fincalc.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.fincalc.config.EngineSettings;
import org.carball.fincalc.model.forecast.CashFlowForecast;
import org.carball.fincalc.model.forecast.CashFlowForecastInput;
import org.carball.fincalc.model.forecast.ForecastMonth;
import org.carball.fincalc.model.forecast.MonthlyAmount;
import org.carball.fincalc.validation.InputValidator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.carball.fincalc.validation.NumericGuards.roundCurrency;

/**
 * Month-by-month cash projection with growth, seasonality and one-off items.
 */
@Slf4j
public class CashFlowForecastEngine {

    private final EngineSettings settings;

    public CashFlowForecastEngine() {
        this(EngineSettings.defaults());
    }

    public CashFlowForecastEngine(EngineSettings settings) {
        this.settings = settings;
    }

    public CashFlowForecast calculate(CashFlowForecastInput input) {
        InputValidator.validate(input);

        int forecastMonths = input.getForecastMonths() != null
                ? input.getForecastMonths()
                : settings.getDefaultForecastMonths();

        Map<Integer, Double> oneTimeExpenses = sumByMonth(input.getOneTimeExpenses());
        Map<Integer, Double> receivables = sumByMonth(input.getExpectedReceivables());
        List<Double> seasonalFactors = input.getSeasonalFactors();

        List<ForecastMonth> months = new ArrayList<>(forecastMonths);
        List<Integer> deficitMonths = new ArrayList<>();
        double cash = input.getStartingCash();
        double totalRevenue = 0;
        double totalExpenses = 0;
        double lowestCash = cash;
        int lowestCashMonth = 0;

        for (int month = 1; month <= forecastMonths; month++) {
            double revenueGrowth = Math.pow(1 + input.getRevenueGrowthRate() / 100, month - 1);
            double expenseGrowth = Math.pow(1 + input.getExpenseGrowthRate() / 100, month - 1);
            int calendarIndex = (month - 1) % 12;
            double seasonal = calendarIndex < seasonalFactors.size() ? seasonalFactors.get(calendarIndex) : 1.0;

            double revenue = input.getMonthlyRevenue() * revenueGrowth * seasonal
                    + receivables.getOrDefault(month, 0.0);
            double expenses = input.getMonthlyExpenses() * expenseGrowth
                    + oneTimeExpenses.getOrDefault(month, 0.0);
            double net = revenue - expenses;
            cash += net;

            totalRevenue += revenue;
            totalExpenses += expenses;

            boolean deficit = cash < 0;
            if (deficit) {
                deficitMonths.add(month);
            }
            if (cash < lowestCash) {
                lowestCash = cash;
                lowestCashMonth = month;
            }

            months.add(new ForecastMonth(month,
                    roundCurrency(revenue),
                    roundCurrency(expenses),
                    roundCurrency(net),
                    roundCurrency(cash),
                    deficit));
        }

        double totalNet = totalRevenue - totalExpenses;
        double averageNet = totalNet / forecastMonths;
        double reserve = averageNet < 0
                ? Math.abs(averageNet) * settings.getDeficitReserveMultiplier()
                : input.getMonthlyExpenses() * settings.getExpenseReserveMultiplier();
        boolean healthy = deficitMonths.isEmpty() && lowestCash >= reserve;
        Integer firstDeficitMonth = deficitMonths.isEmpty() ? null : deficitMonths.get(0);

        log.debug("Total revenue: {}", totalRevenue);
        log.debug("Total expenses: {}", totalExpenses);
        log.debug("Ending cash: {}", cash);
        if (firstDeficitMonth != null) {
            log.debug("Cash goes negative in month {}", firstDeficitMonth);
        }

        return new CashFlowForecast(
                List.copyOf(months),
                roundCurrency(totalRevenue),
                roundCurrency(totalExpenses),
                roundCurrency(totalNet),
                roundCurrency(cash),
                roundCurrency(lowestCash),
                lowestCashMonth,
                List.copyOf(deficitMonths),
                firstDeficitMonth,
                roundCurrency(reserve),
                roundCurrency(averageNet),
                healthy);
    }

    private static Map<Integer, Double> sumByMonth(List<MonthlyAmount> amounts) {
        Map<Integer, Double> byMonth = new HashMap<>();
        for (MonthlyAmount amount : amounts) {
            byMonth.merge(amount.getMonth(), amount.getAmount(), Double::sum);
        }
        return byMonth;
    }
}
