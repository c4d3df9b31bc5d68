package org.carball.fincalc.model.sensitivity;

import lombok.Getter;
import org.carball.fincalc.model.scenario.ScenarioInput;

import java.util.List;

/**
 * Scenario fields that can be perturbed in a sensitivity sweep.
 */
@Getter
public enum SensitivityVariable {

    INITIAL_INVESTMENT("initialInvestment", "Initial Investment") {
        @Override
        public ScenarioInput scale(ScenarioInput input, double factor) {
            return input.toBuilder().initialInvestment(input.getInitialInvestment() * factor).build();
        }
    },
    YEARLY_REVENUE("yearlyRevenue", "Yearly Revenue") {
        @Override
        public ScenarioInput scale(ScenarioInput input, double factor) {
            return input.toBuilder().yearlyRevenue(input.getYearlyRevenue() * factor).build();
        }
    },
    OPERATING_COSTS("operatingCosts", "Operating Costs") {
        @Override
        public ScenarioInput scale(ScenarioInput input, double factor) {
            return input.toBuilder().operatingCosts(input.getOperatingCosts() * factor).build();
        }
    },
    MAINTENANCE_COSTS("maintenanceCosts", "Maintenance Costs") {
        @Override
        public ScenarioInput scale(ScenarioInput input, double factor) {
            return input.toBuilder().maintenanceCosts(input.getMaintenanceCosts() * factor).build();
        }
    };

    private final String fieldName;
    private final String displayName;

    SensitivityVariable(String fieldName, String displayName) {
        this.fieldName = fieldName;
        this.displayName = displayName;
    }

    /**
     * Returns a copy of {@code input} with only this field multiplied by {@code factor}.
     */
    public abstract ScenarioInput scale(ScenarioInput input, double factor);

    public static List<SensitivityVariable> defaults() {
        return List.of(values());
    }

    public static SensitivityVariable fromFieldName(String name) {
        for (SensitivityVariable variable : values()) {
            if (variable.fieldName.equalsIgnoreCase(name) || variable.name().equalsIgnoreCase(name)) {
                return variable;
            }
        }
        throw new IllegalArgumentException("Unknown sensitivity variable: " + name);
    }
}
