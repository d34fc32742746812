package com.jay.ptanalyzer.layer4_signal;

import com.jay.ptanalyzer.config.AnalysisConfig;
import com.jay.ptanalyzer.model.Recommendation;
import com.jay.ptanalyzer.model.enums.RecommendationAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Layer 4 — Recommendation Engine.
 * Maps the target vs current price delta and the confidence score to an action.
 *
 * Branches are checked in a fixed order and the first match wins:
 * BUY, STRONG BUY, SELL, STRONG SELL, then HOLD. The plain BUY/SELL checks come
 * first, so a delta beyond the strong threshold at high confidence stays BUY/SELL;
 * the strong labels are only reached at confidence between the two bars.
 * A non-positive current price yields HOLD with no expected return.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecommendationEngine {

    private final AnalysisConfig config;

    public Recommendation recommend(double targetPrice, double currentPrice, double confidenceScore) {
        if (currentPrice <= 0) {
            log.warn("Current price {} is not positive — no recommendation", currentPrice);
            return new Recommendation(RecommendationAction.HOLD, "Current price unavailable", 0);
        }

        AnalysisConfig.Recommendation cfg = config.recommendation();
        double delta = (targetPrice - currentPrice) / currentPrice * 100;

        RecommendationAction action = RecommendationAction.HOLD;
        String reasoning = "Target price close to current price";

        if (delta > cfg.getBuyDeltaPct() && confidenceScore >= cfg.getMinConfidence()) {
            action = RecommendationAction.BUY;
            reasoning = String.format("Target price indicates %.1f%% upside potential", delta);
        } else if (delta > cfg.getStrongDeltaPct() && confidenceScore >= cfg.getMinConfidenceStrong()) {
            action = RecommendationAction.STRONG_BUY;
            reasoning = String.format("Strong upside potential of %.1f%%", delta);
        } else if (delta < -cfg.getBuyDeltaPct() && confidenceScore >= cfg.getMinConfidence()) {
            action = RecommendationAction.SELL;
            reasoning = String.format("Target price indicates %.1f%% downside risk", Math.abs(delta));
        } else if (delta < -cfg.getStrongDeltaPct() && confidenceScore >= cfg.getMinConfidenceStrong()) {
            action = RecommendationAction.STRONG_SELL;
            reasoning = String.format("Significant downside risk of %.1f%%", Math.abs(delta));
        }

        log.debug("Recommendation {} | delta={}% confidence={}", action.label(), delta, confidenceScore);
        return new Recommendation(action, reasoning, delta);
    }
}
