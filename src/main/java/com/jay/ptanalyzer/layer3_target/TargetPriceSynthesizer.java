package com.jay.ptanalyzer.layer3_target;

import com.jay.ptanalyzer.config.AnalysisConfig;
import com.jay.ptanalyzer.model.BollingerPoint;
import com.jay.ptanalyzer.model.FibonacciLevels;
import com.jay.ptanalyzer.model.IndicatorSet;
import com.jay.ptanalyzer.model.PriceLevel;
import com.jay.ptanalyzer.model.PriceTarget;
import com.jay.ptanalyzer.model.SupportResistance;
import com.jay.ptanalyzer.model.TargetCandidate;
import com.jay.ptanalyzer.model.TrendState;
import com.jay.ptanalyzer.model.VolatilityState;
import com.jay.ptanalyzer.model.enums.TargetMethod;
import com.jay.ptanalyzer.model.enums.TargetSource;
import com.jay.ptanalyzer.model.enums.Trend;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer 3 — Target Price Synthesizer.
 * Collects weighted price candidates from the bands, retracement levels,
 * support/resistance and the medium SMA, chosen by trend direction, and
 * returns their weight-normalized mean with a volatility-scaled range.
 *
 * Any input may be null; a missing input contributes no candidates.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TargetPriceSynthesizer {

    private final AnalysisConfig config;

    public PriceTarget synthesizeTarget(IndicatorSet indicators,
                                        FibonacciLevels fibonacci,
                                        SupportResistance supportResistance,
                                        TrendState trend,
                                        VolatilityState volatility,
                                        double currentPrice) {
        AnalysisConfig.Target cfg = config.target();
        Trend direction = trend != null && trend.trend() != null ? trend.trend() : Trend.NEUTRAL;
        List<TargetCandidate> candidates = new ArrayList<>();

        // ── Bollinger bands ────────────────────────────────────────────────────
        BollingerPoint bb = indicators != null ? indicators.latestBollinger() : null;
        if (bb != null) {
            addIfPositive(candidates, bb.upperBand(), cfg.getBollingerUpperWeight(), TargetSource.BOLLINGER_UPPER);
            addIfPositive(candidates, bb.middleBand(), cfg.getBollingerMiddleWeight(), TargetSource.BOLLINGER_MIDDLE);
        }

        // ── Fibonacci retracement ──────────────────────────────────────────────
        if (fibonacci != null && direction.isUptrend()) {
            addIfPositive(candidates, fibonacci.level(FibonacciLevels.LEVEL_618),
                cfg.getFibonacciWeight(), TargetSource.FIBONACCI_UP);
        } else if (fibonacci != null && direction.isDowntrend()) {
            addIfPositive(candidates, fibonacci.level(FibonacciLevels.LEVEL_382),
                cfg.getFibonacciWeight(), TargetSource.FIBONACCI_DOWN);
        }

        // ── Support / resistance (top-ranked level) ────────────────────────────
        if (supportResistance != null && direction.isUptrend() && !supportResistance.resistance().isEmpty()) {
            PriceLevel resistance = supportResistance.resistance().get(0);
            addIfPositive(candidates, resistance.price(), cfg.getLevelWeight(), TargetSource.RESISTANCE);
        }
        if (supportResistance != null && direction.isDowntrend() && !supportResistance.support().isEmpty()) {
            PriceLevel support = supportResistance.support().get(0);
            addIfPositive(candidates, support.price(), cfg.getLevelWeight(), TargetSource.SUPPORT);
        }

        // ── Medium SMA projection ──────────────────────────────────────────────
        if (trend != null && trend.movingAverages() != null) {
            double medium = trend.movingAverages().mediumTerm();
            if (direction.isUptrend() && medium > 0) {
                candidates.add(new TargetCandidate(medium * cfg.getMaProjectionUp(),
                    cfg.getMaProjectionWeight(), TargetSource.MA_PROJECTION_UP));
            } else if (direction.isDowntrend() && medium > 0) {
                candidates.add(new TargetCandidate(medium * cfg.getMaProjectionDown(),
                    cfg.getMaProjectionWeight(), TargetSource.MA_PROJECTION_DOWN));
            }
        }

        if (candidates.isEmpty()) {
            double range = rangeAdjustment(currentPrice, volatility);
            log.debug("No target candidates — falling back to current price {}", currentPrice);
            return new PriceTarget(currentPrice, TargetMethod.CURRENT_PRICE,
                currentPrice - range, currentPrice + range, List.of());
        }

        double totalWeight = 0;
        double weightedSum = 0;
        for (TargetCandidate c : candidates) {
            totalWeight += c.weight();
            weightedSum += c.price() * c.weight();
        }
        double target = totalWeight > 0 ? weightedSum / totalWeight : currentPrice;
        double range = rangeAdjustment(target, volatility);

        log.debug("Target {} from {} candidates (trend={})", target, candidates.size(), direction.label());
        return new PriceTarget(target, TargetMethod.WEIGHTED_AVERAGE,
            target - range, target + range, List.copyOf(candidates));
    }

    /** Half the annualized volatility of the price, or a flat percentage when volatility is unknown or zero. */
    private double rangeAdjustment(double price, VolatilityState volatility) {
        AnalysisConfig.Target cfg = config.target();
        if (volatility != null && volatility.annualizedVolatility() != 0) {
            return volatility.annualizedVolatility() * price * cfg.getVolatilityRangeFactor();
        }
        return price * cfg.getFallbackRangePct();
    }

    private static void addIfPositive(List<TargetCandidate> candidates, double price,
                                      double weight, TargetSource source) {
        if (price > 0) {
            candidates.add(new TargetCandidate(price, weight, source));
        }
    }
}
