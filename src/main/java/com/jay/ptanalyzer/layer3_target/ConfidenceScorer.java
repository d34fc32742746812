package com.jay.ptanalyzer.layer3_target;

import com.jay.ptanalyzer.config.AnalysisConfig;
import com.jay.ptanalyzer.model.ConfidenceScore;
import com.jay.ptanalyzer.model.IndicatorSet;
import com.jay.ptanalyzer.model.SupportResistance;
import com.jay.ptanalyzer.model.TrendState;
import com.jay.ptanalyzer.model.VolatilityState;
import com.jay.ptanalyzer.model.enums.ConfidenceLevel;
import com.jay.ptanalyzer.model.enums.Trend;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Layer 3 — Confidence Scorer.
 * Starts at a neutral 50 and applies independent adjustments for RSI coverage,
 * trend clarity, volatility tier, level coverage and sample size. Scores 0-100.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfidenceScorer {

    private static final int BASE_SCORE = 50;

    private final AnalysisConfig config;

    public ConfidenceScore scoreConfidence(IndicatorSet indicators,
                                           TrendState trend,
                                           VolatilityState volatility,
                                           SupportResistance supportResistance,
                                           int sampleSize) {
        int score = BASE_SCORE;

        // RSI in the 30-70 band
        Double rsi = indicators != null ? indicators.latestRsi() : null;
        if (rsi == null) {
            score -= 10;
        } else if (rsi >= 30 && rsi <= 70) {
            score += 10;
        }

        // Trend clarity
        if (trend != null && trend.trend() != null && trend.trend() != Trend.NEUTRAL) score += 15;
        else score -= 15;

        // Volatility tier
        if (volatility == null || volatility.currentLevel() == null) {
            score -= 10;
        } else {
            switch (volatility.currentLevel()) {
                case LOW -> score += 10;
                case MEDIUM -> score += 5;
                case HIGH -> { }
            }
        }

        // Level coverage
        if (supportResistance != null
            && (supportResistance.support().size() >= 2 || supportResistance.resistance().size() >= 2)) {
            score += 10;
        } else {
            score -= 10;
        }

        // Sample size
        if (sampleSize >= 200) score += 15;
        else if (sampleSize >= 100) score += 5;
        else if (sampleSize >= 50) { /* no change */ }
        else if (sampleSize > 0) score -= 20;
        else score = 0;

        score = Math.max(0, Math.min(100, score));
        log.debug("Confidence {} | rsi={} trend={} volatility={} samples={}",
            score, rsi, trend != null ? trend.trend() : null,
            volatility != null ? volatility.currentLevel() : null, sampleSize);

        return new ConfidenceScore(score, classify(score));
    }

    private ConfidenceLevel classify(int score) {
        AnalysisConfig.Confidence cfg = config.confidence();
        if (score >= cfg.getHighThreshold()) return ConfidenceLevel.HIGH;
        if (score >= cfg.getMediumThreshold()) return ConfidenceLevel.MEDIUM;
        return ConfidenceLevel.LOW;
    }
}
