package org.carball.fincalc.model.employee;

import com.fasterxml.jackson.annotation.JsonCreator;
import lombok.Getter;

/**
 * Role families with the typical loaded cost per hour and revenue-to-cost productivity.
 */
@Getter
public enum RoleType {

    SALES(35, 3.0),
    OPERATIONS(28, 2.0),
    TECHNICAL(45, 2.5),
    ADMINISTRATIVE(22, 1.5);

    private final double averageCostPerHour;
    private final double averageProductivity;

    RoleType(double averageCostPerHour, double averageProductivity) {
        this.averageCostPerHour = averageCostPerHour;
        this.averageProductivity = averageProductivity;
    }

    @JsonCreator
    public static RoleType fromName(String name) {
        for (RoleType role : values()) {
            if (role.name().equalsIgnoreCase(name)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role type: " + name);
    }
}
