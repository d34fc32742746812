package com.jay.ptanalyzer.model;

import java.util.List;

/**
 * Support and resistance levels, each list ranked by touch count descending.
 */
public record SupportResistance(List<PriceLevel> support, List<PriceLevel> resistance) {

    public static SupportResistance empty() {
        return new SupportResistance(List.of(), List.of());
    }
}
