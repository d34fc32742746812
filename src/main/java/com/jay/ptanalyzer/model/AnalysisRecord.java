package com.jay.ptanalyzer.model;

import com.jay.ptanalyzer.model.enums.ConfidenceLevel;
import com.jay.ptanalyzer.model.enums.TargetMethod;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Full price analysis for a single symbol.
 * Built fresh by PriceAnalysisService on every call and immutable afterwards.
 */
@Value
@Builder(toBuilder = true)
public class AnalysisRecord {

    String    symbol;
    LocalDate analysisDate;

    // ── Price snapshot ────────────────────────────────────────────────────────
    double currentPrice;
    double priceChange;
    double priceChangePercent;
    long   volume;

    // ── Target ────────────────────────────────────────────────────────────────
    double                targetPrice;
    TargetMethod          analysisMethod;
    double                priceRangeLow;
    double                priceRangeHigh;
    List<TargetCandidate> targetBreakdown;

    // ── Confidence ────────────────────────────────────────────────────────────
    int             confidenceScore;
    ConfidenceLevel confidenceLevel;

    // ── Calculations ──────────────────────────────────────────────────────────
    IndicatorSet         indicators;     // null below the indicator gate
    AnalysisCalculations calculations;

    // ── Verdict ───────────────────────────────────────────────────────────────
    Recommendation recommendation;

    AnalystConsensus analystConsensus;   // null when the caller supplied none
}
