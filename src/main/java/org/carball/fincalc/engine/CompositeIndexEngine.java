package org.carball.fincalc.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.fincalc.model.composite.CompositeIndex;
import org.carball.fincalc.model.composite.CompositeIndices;
import org.carball.fincalc.model.composite.CompositeInputs;
import org.carball.fincalc.model.composite.EfficiencyInputs;
import org.carball.fincalc.model.composite.FrictionInputs;
import org.carball.fincalc.model.composite.IndexRating;
import org.carball.fincalc.model.composite.TechDebtInputs;
import org.carball.fincalc.validation.InputValidator;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static org.carball.fincalc.validation.NumericGuards.round;
import static org.carball.fincalc.validation.NumericGuards.safeDivide;

/**
 * Computes the OFI, TFDI and SER indices. Each index only needs its own input group,
 * so a partial {@link CompositeInputs} yields a partial result.
 */
@Slf4j
public class CompositeIndexEngine {

    private static final int INDEX_DECIMALS = 4;
    private static final double MIN_BURN_CHANGE = 0.01;
    private static final double BURN_REDUCTION_BONUS = 1.5;

    public CompositeIndices calculate(CompositeInputs inputs) {
        if (inputs == null) {
            throw new IllegalArgumentException("Composite inputs are required");
        }

        Map<CompositeIndex, IndexRating> ratings = new EnumMap<>(CompositeIndex.class);
        Double ofi = null;
        Double tfdi = null;
        Double ser = null;

        if (inputs.getFriction() != null) {
            ofi = operationalFriction(inputs.getFriction());
            ratings.put(CompositeIndex.OFI, CompositeIndex.OFI.rate(ofi));
        }
        if (inputs.getTechDebt() != null) {
            tfdi = techDebtDrag(inputs.getTechDebt());
            ratings.put(CompositeIndex.TFDI, CompositeIndex.TFDI.rate(tfdi));
        }
        if (inputs.getEfficiency() != null) {
            ser = strategicEfficiency(inputs.getEfficiency());
            ratings.put(CompositeIndex.SER, CompositeIndex.SER.rate(ser));
        }

        log.debug("OFI: {}, TFDI: {}, SER: {}", ofi, tfdi, ser);
        return new CompositeIndices(ofi, tfdi, ser, Collections.unmodifiableMap(ratings));
    }

    /**
     * Annual cost of manual work as a share of revenue.
     */
    public double operationalFriction(FrictionInputs friction) {
        InputValidator.validate(friction);
        double annualManualCost = friction.getManualHoursPerWeek() * friction.getHourlyCost() * 52;
        return round(safeDivide(annualManualCost, friction.getCurrentRevenue()), INDEX_DECIMALS);
    }

    /**
     * Maintenance effort plus incident cost as a share of the engineering budget.
     */
    public double techDebtDrag(TechDebtInputs techDebt) {
        InputValidator.validate(techDebt);
        double maintenanceRatio = safeDivide(techDebt.getMaintenanceHoursPerSprint(), techDebt.getTotalDevHoursPerSprint());
        double annualDrag = maintenanceRatio * techDebt.getTeamAnnualCost() + techDebt.getIncidentCostPerMonth() * 12;
        return round(safeDivide(annualDrag, techDebt.getTeamAnnualCost()), INDEX_DECIMALS);
    }

    /**
     * Revenue growth per unit of burn-rate change. Shrinking burn earns a 1.5x bonus.
     */
    public double strategicEfficiency(EfficiencyInputs efficiency) {
        InputValidator.validate(efficiency);
        double revenueGrowth = safeDivide(
                efficiency.getCurrentRevenue() - efficiency.getPreviousRevenue(),
                efficiency.getPreviousRevenue());
        double burnChange = safeDivide(
                efficiency.getCurrentBurnRate() - efficiency.getPreviousBurnRate(),
                efficiency.getPreviousBurnRate(),
                MIN_BURN_CHANGE);

        double ser = revenueGrowth / Math.max(Math.abs(burnChange), MIN_BURN_CHANGE);
        if (burnChange < 0) {
            ser *= BURN_REDUCTION_BONUS;
        }
        return round(ser, INDEX_DECIMALS);
    }
}
