package com.jay.ptanalyzer.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Indicator sequences for one price series, oldest value first.
 * Each field is null when the series is shorter than that indicator's minimum.
 */
@Value
@Builder
public class IndicatorSet {

    // ── Moving averages ───────────────────────────────────────────────────────
    List<Double> sma20;
    List<Double> sma50;
    List<Double> sma200;
    List<Double> ema12;
    List<Double> ema26;

    // ── Oscillators / bands ───────────────────────────────────────────────────
    List<Double> rsi;
    List<MacdPoint> macd;
    List<BollingerPoint> bollinger;

    // ── Trend strength ────────────────────────────────────────────────────────
    List<Double> adx;

    /** Most recent RSI reading, or null when RSI is unavailable. */
    public Double latestRsi() {
        return rsi == null || rsi.isEmpty() ? null : rsi.get(rsi.size() - 1);
    }

    public BollingerPoint latestBollinger() {
        return bollinger == null || bollinger.isEmpty() ? null : bollinger.get(bollinger.size() - 1);
    }
}
