package com.jay.ptanalyzer.model;

/**
 * Raw stage outputs behind an {@link AnalysisRecord}.
 * {@code technical} and {@code fibonacci} are null when the series was below the stage gate.
 */
public record AnalysisCalculations(
    IndicatorSet technical,
    FibonacciLevels fibonacci,
    SupportResistance supportResistance,
    TrendState trend,
    VolatilityState volatility
) {}
