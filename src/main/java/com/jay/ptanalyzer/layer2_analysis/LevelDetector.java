package com.jay.ptanalyzer.layer2_analysis;

import com.jay.ptanalyzer.config.AnalysisConfig;
import com.jay.ptanalyzer.model.FibonacciLevels;
import com.jay.ptanalyzer.model.PriceBar;
import com.jay.ptanalyzer.model.PriceLevel;
import com.jay.ptanalyzer.model.SupportResistance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layer 2 — Level Detector.
 * Fibonacci retracements over the close range, and support/resistance clusters
 * found in the low and high columns by touch counting.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LevelDetector {

    private static final double[] FIB_RATIOS = {0, 0.236, 0.382, 0.5, 0.618, 1.0};
    private static final String[] FIB_LABELS = {
        FibonacciLevels.LEVEL_0, FibonacciLevels.LEVEL_236, FibonacciLevels.LEVEL_382,
        FibonacciLevels.LEVEL_50, FibonacciLevels.LEVEL_618, FibonacciLevels.LEVEL_100
    };

    private static final int MIN_LEVEL_BARS = 5;

    private final AnalysisConfig config;

    /**
     * Retracement levels between the highest and lowest close of the window.
     * 0% maps to the high and 100% to the low. Fewer than 2 bars gives an all-zero result.
     */
    public FibonacciLevels fibonacciLevels(List<PriceBar> bars) {
        if (bars == null || bars.size() < 2) {
            return FibonacciLevels.zero();
        }

        double high = bars.stream().mapToDouble(PriceBar::getClose).max().orElse(0);
        double low  = bars.stream().mapToDouble(PriceBar::getClose).min().orElse(0);
        double diff = high - low;

        Map<String, Double> levels = new LinkedHashMap<>();
        for (int i = 0; i < FIB_RATIOS.length; i++) {
            levels.put(FIB_LABELS[i], high - diff * FIB_RATIOS[i]);
        }
        // exact endpoints, no rounding drift at 100%
        levels.put(FibonacciLevels.LEVEL_0, high);
        levels.put(FibonacciLevels.LEVEL_100, low);

        return new FibonacciLevels(high, low, Collections.unmodifiableMap(levels));
    }

    /**
     * Support levels from bar lows and resistance levels from bar highs.
     * Fewer than 5 bars gives empty lists.
     */
    public SupportResistance supportResistance(List<PriceBar> bars) {
        if (bars == null || bars.size() < MIN_LEVEL_BARS) {
            return SupportResistance.empty();
        }

        double[] lows  = bars.stream().mapToDouble(PriceBar::getLow).toArray();
        double[] highs = bars.stream().mapToDouble(PriceBar::getHigh).toArray();

        List<PriceLevel> support    = findLevels(lows);
        List<PriceLevel> resistance = findLevels(highs);
        log.debug("Level scan over {} bars: {} support, {} resistance",
            bars.size(), support.size(), resistance.size());
        return new SupportResistance(support, resistance);
    }

    /**
     * A point (ignoring the first and last two) is a candidate when it is not more than
     * the tolerance below either neighbour. Its touch count is the number of other points
     * within the tolerance of its price. Candidates with enough touches are ranked by
     * touch count, ties kept in series order.
     */
    List<PriceLevel> findLevels(double[] data) {
        if (data.length < MIN_LEVEL_BARS) {
            return List.of();
        }

        AnalysisConfig.Levels cfg = config.levels();
        double tolerance = cfg.getTolerance();
        List<PriceLevel> levels = new ArrayList<>();

        for (int i = 2; i < data.length - 2; i++) {
            double current = data[i];

            boolean isLevel = current >= data[i - 1] * (1 - tolerance)
                && current >= data[i + 1] * (1 - tolerance);
            if (!isLevel) continue;

            int touches = 0;
            for (int j = 0; j < data.length; j++) {
                if (j != i && Math.abs(data[j] - current) < current * tolerance) {
                    touches++;
                }
            }

            if (touches >= cfg.getMinTouches()) {
                levels.add(new PriceLevel(current, touches, i));
            }
        }

        levels.sort(Comparator.comparingInt(PriceLevel::touchCount).reversed());
        return List.copyOf(levels.subList(0, Math.min(cfg.getMaxLevels(), levels.size())));
    }
}
