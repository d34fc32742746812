package com.jay.ptanalyzer.layer5_orchestration;

import com.jay.ptanalyzer.config.AnalysisConfig;
import com.jay.ptanalyzer.exception.NoDataAvailableException;
import com.jay.ptanalyzer.layer1_indicators.IndicatorLibrary;
import com.jay.ptanalyzer.layer2_analysis.LevelDetector;
import com.jay.ptanalyzer.layer2_analysis.TrendVolatilityClassifier;
import com.jay.ptanalyzer.layer3_target.ConfidenceScorer;
import com.jay.ptanalyzer.layer3_target.TargetPriceSynthesizer;
import com.jay.ptanalyzer.layer4_signal.RecommendationEngine;
import com.jay.ptanalyzer.model.AnalysisCalculations;
import com.jay.ptanalyzer.model.AnalysisRecord;
import com.jay.ptanalyzer.model.AnalystConsensus;
import com.jay.ptanalyzer.model.ConfidenceScore;
import com.jay.ptanalyzer.model.FibonacciLevels;
import com.jay.ptanalyzer.model.IndicatorSet;
import com.jay.ptanalyzer.model.PriceBar;
import com.jay.ptanalyzer.model.PriceTarget;
import com.jay.ptanalyzer.model.QuoteSnapshot;
import com.jay.ptanalyzer.model.Recommendation;
import com.jay.ptanalyzer.model.SupportResistance;
import com.jay.ptanalyzer.model.TrendState;
import com.jay.ptanalyzer.model.VolatilityState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

/**
 * Single-symbol price analysis.
 * Runs indicators, levels, trend and volatility over the supplied daily series,
 * then the target synthesizer, confidence scorer and recommendation engine,
 * and returns a fresh {@link AnalysisRecord}.
 *
 * Each stage is gated on the series length (see analysis.yaml, section pipeline);
 * a stage below its gate contributes null or its documented default.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PriceAnalysisService {

    private final IndicatorLibrary indicatorLibrary;
    private final LevelDetector levelDetector;
    private final TrendVolatilityClassifier classifier;
    private final TargetPriceSynthesizer targetSynthesizer;
    private final ConfidenceScorer confidenceScorer;
    private final RecommendationEngine recommendationEngine;
    private final AnalysisConfig config;

    /**
     * @param symbol    instrument symbol, copied into the record
     * @param bars      daily bars, oldest first
     * @param quote     latest quote; when null the last close stands in with zero change and volume
     * @param consensus analyst figures passed through unvalidated, may be null
     * @throws NoDataAvailableException when {@code bars} is null or empty
     */
    public AnalysisRecord analyse(String symbol, List<PriceBar> bars,
                                  QuoteSnapshot quote, AnalystConsensus consensus) {
        if (bars == null || bars.isEmpty()) {
            log.warn("No price data for {} — cannot analyse", symbol);
            throw new NoDataAvailableException(symbol);
        }

        int size = bars.size();
        log.info("Price analysis started for {} ({} bars)", symbol, size);

        AnalysisConfig.Pipeline gates = config.pipeline();
        if (size < gates.getMinBarsIndicators()) {
            log.warn("Limited data for {} ({} bars) — results may be less accurate", symbol, size);
        }

        // ── Stage 1: independent calculations ──────────────────────────────────
        IndicatorSet technical = size >= gates.getMinBarsIndicators()
            ? indicatorLibrary.computeIndicators(bars) : null;
        FibonacciLevels fibonacci = size >= gates.getMinBarsLevels()
            ? levelDetector.fibonacciLevels(bars) : null;
        SupportResistance levels = size >= gates.getMinBarsLevels()
            ? levelDetector.supportResistance(bars) : SupportResistance.empty();
        TrendState trend = size >= gates.getMinBarsTrend()
            ? classifier.classifyTrend(bars) : TrendState.neutral();
        VolatilityState volatility = size >= gates.getMinBarsVolatility()
            ? classifier.classifyVolatility(bars) : VolatilityState.calm();

        log.debug("{} stages | indicators={} levels={} trend={} volatility={}", symbol,
            technical != null, fibonacci != null, trend.trend().label(), volatility.currentLevel());

        // ── Stage 2: target + confidence ───────────────────────────────────────
        double lastClose = bars.get(size - 1).getClose();
        PriceTarget target = targetSynthesizer.synthesizeTarget(
            technical, fibonacci, levels, trend, volatility, lastClose);
        ConfidenceScore confidence = confidenceScorer.scoreConfidence(
            technical, trend, volatility, levels, size);

        // ── Stage 3: recommendation against the live price ─────────────────────
        double currentPrice = quote != null ? quote.getPrice() : lastClose;
        Recommendation recommendation = recommendationEngine.recommend(
            target.price(), currentPrice, confidence.score());

        log.info("Price analysis complete for {}: target={} confidence={} action={}",
            symbol, String.format("%.2f", target.price()), confidence.score(),
            recommendation.action().label());

        return AnalysisRecord.builder()
            .symbol(symbol)
            .analysisDate(LocalDate.now())
            // Price
            .currentPrice(currentPrice)
            .priceChange(quote != null ? quote.change() : 0)
            .priceChangePercent(quote != null ? quote.changePercent() : 0)
            .volume(quote != null ? quote.getVolume() : 0)
            // Target
            .targetPrice(target.price())
            .analysisMethod(target.method())
            .priceRangeLow(target.rangeLow())
            .priceRangeHigh(target.rangeHigh())
            .targetBreakdown(target.breakdown())
            // Confidence
            .confidenceScore(confidence.score())
            .confidenceLevel(confidence.level())
            // Calculations
            .indicators(technical)
            .calculations(new AnalysisCalculations(technical, fibonacci, levels, trend, volatility))
            // Verdict
            .recommendation(recommendation)
            .analystConsensus(consensus)
            .build();
    }

    public AnalysisRecord analyse(String symbol, List<PriceBar> bars) {
        return analyse(symbol, bars, null, null);
    }
}
