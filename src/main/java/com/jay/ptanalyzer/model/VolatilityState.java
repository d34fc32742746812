package com.jay.ptanalyzer.model;

import com.jay.ptanalyzer.model.enums.VolatilityLevel;

public record VolatilityState(double standardDeviation, double annualizedVolatility,
                              VolatilityLevel currentLevel) {

    /** Default used when there are too few closes to measure returns. */
    public static VolatilityState calm() {
        return new VolatilityState(0, 0, VolatilityLevel.LOW);
    }
}
