package com.jay.ptanalyzer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Retracement levels between the period high and low close.
 * {@code levels} is keyed by ratio label in order 0% → 100%.
 */
public record FibonacciLevels(double high, double low, Map<String, Double> levels) {

    public static final String LEVEL_0   = "0%";
    public static final String LEVEL_236 = "23.6%";
    public static final String LEVEL_382 = "38.2%";
    public static final String LEVEL_50  = "50%";
    public static final String LEVEL_618 = "61.8%";
    public static final String LEVEL_100 = "100%";

    public double level(String label) {
        Double price = levels.get(label);
        return price != null ? price : 0;
    }

    public static FibonacciLevels zero() {
        Map<String, Double> levels = new LinkedHashMap<>();
        for (String label : new String[] {LEVEL_0, LEVEL_236, LEVEL_382, LEVEL_50, LEVEL_618, LEVEL_100}) {
            levels.put(label, 0.0);
        }
        return new FibonacciLevels(0, 0, Collections.unmodifiableMap(levels));
    }
}
