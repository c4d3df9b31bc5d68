package org.carball.fincalc.model.marketing;

import com.fasterxml.jackson.annotation.JsonCreator;
import lombok.Getter;

/**
 * Acquisition channels with their typical cost per acquisition and conversion rate (%).
 */
@Getter
public enum MarketingChannel {

    FACEBOOK(50, 2.5),
    GOOGLE(45, 3.0),
    INSTAGRAM(55, 2.0),
    EMAIL(15, 5.0),
    REFERRAL(25, 8.0),
    OTHER(40, 2.5);

    private final double averageCac;
    private final double averageConversionRate;

    MarketingChannel(double averageCac, double averageConversionRate) {
        this.averageCac = averageCac;
        this.averageConversionRate = averageConversionRate;
    }

    @JsonCreator
    public static MarketingChannel fromName(String name) {
        for (MarketingChannel channel : values()) {
            if (channel.name().equalsIgnoreCase(name)) {
                return channel;
            }
        }
        throw new IllegalArgumentException("Unknown marketing channel: " + name);
    }
}
