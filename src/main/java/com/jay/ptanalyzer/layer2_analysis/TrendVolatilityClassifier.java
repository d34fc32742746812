package com.jay.ptanalyzer.layer2_analysis;

import com.jay.ptanalyzer.config.AnalysisConfig;
import com.jay.ptanalyzer.layer1_indicators.IndicatorLibrary;
import com.jay.ptanalyzer.model.MovingAverages;
import com.jay.ptanalyzer.model.PriceBar;
import com.jay.ptanalyzer.model.TrendState;
import com.jay.ptanalyzer.model.VolatilityState;
import com.jay.ptanalyzer.model.enums.Trend;
import com.jay.ptanalyzer.model.enums.VolatilityLevel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Layer 2 — Trend and Volatility Classifier.
 * Trend label from the ordering of price against the 20/50/200 bar SMAs,
 * volatility tier from the dispersion of recent log returns.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TrendVolatilityClassifier {

    public static final int MIN_TREND_BARS = IndicatorLibrary.SMA_LONG;

    private final IndicatorLibrary indicators;
    private final AnalysisConfig config;

    /**
     * Classifies the trend. Needs 200 bars; shorter series are neutral with no averages.
     */
    public TrendState classifyTrend(List<PriceBar> bars) {
        if (bars == null || bars.size() < MIN_TREND_BARS) {
            return TrendState.neutral();
        }

        MovingAverages ma = new MovingAverages(
            indicators.latestSma(bars, IndicatorLibrary.SMA_SHORT),
            indicators.latestSma(bars, IndicatorLibrary.SMA_MEDIUM),
            indicators.latestSma(bars, IndicatorLibrary.SMA_LONG));
        double price = bars.get(bars.size() - 1).getClose();

        Trend trend = Trend.NEUTRAL;
        if (price > ma.shortTerm() && ma.shortTerm() > ma.mediumTerm() && ma.mediumTerm() > ma.longTerm()) {
            trend = Trend.STRONG_UPTREND;
        } else if (price > ma.shortTerm() && ma.shortTerm() > ma.mediumTerm()) {
            trend = Trend.UPTREND;
        } else if (price < ma.shortTerm() && ma.shortTerm() < ma.mediumTerm() && ma.mediumTerm() < ma.longTerm()) {
            trend = Trend.STRONG_DOWNTREND;
        } else if (price < ma.shortTerm() && ma.shortTerm() < ma.mediumTerm()) {
            trend = Trend.DOWNTREND;
        }

        log.debug("Trend {} | price={} SMA20={} SMA50={} SMA200={}",
            trend.label(), price, ma.shortTerm(), ma.mediumTerm(), ma.longTerm());
        return new TrendState(trend, ma);
    }

    public VolatilityState classifyVolatility(List<PriceBar> bars) {
        return classifyVolatility(bars, config.volatility().getPeriod());
    }

    /**
     * Sample standard deviation of log returns over the most recent
     * {@code min(period, size)} closes, annualized by √(trading days).
     * Fewer than 2 bars gives a zeroed low-tier state.
     */
    public VolatilityState classifyVolatility(List<PriceBar> bars, int period) {
        if (bars == null || bars.size() < 2) {
            return VolatilityState.calm();
        }

        AnalysisConfig.Volatility cfg = config.volatility();
        int window = Math.min(period, bars.size());
        List<PriceBar> recent = bars.subList(bars.size() - window, bars.size());
        if (recent.size() < 2) {
            return VolatilityState.calm();
        }

        double[] returns = new double[recent.size() - 1];
        for (int i = 1; i < recent.size(); i++) {
            returns[i - 1] = Math.log(recent.get(i).getClose() / recent.get(i - 1).getClose());
        }

        double stdDev = sampleStdDev(returns);
        double annualized = stdDev * Math.sqrt(cfg.getTradingDaysPerYear());

        VolatilityLevel level;
        if (annualized > cfg.getHighThreshold()) level = VolatilityLevel.HIGH;
        else if (annualized > cfg.getMediumThreshold()) level = VolatilityLevel.MEDIUM;
        else level = VolatilityLevel.LOW;

        return new VolatilityState(stdDev, annualized, level);
    }

    private static double sampleStdDev(double[] values) {
        if (values.length < 2) return 0;
        double mean = 0;
        for (double v : values) mean += v;
        mean /= values.length;

        double sumSq = 0;
        for (double v : values) sumSq += (v - mean) * (v - mean);
        return Math.sqrt(sumSq / (values.length - 1));
    }
}
