package com.jay.ptanalyzer.layer2_analysis;

import com.jay.ptanalyzer.config.AnalysisConfig;
import com.jay.ptanalyzer.layer1_indicators.IndicatorLibrary;
import com.jay.ptanalyzer.model.PriceBar;
import com.jay.ptanalyzer.model.TrendState;
import com.jay.ptanalyzer.model.VolatilityState;
import com.jay.ptanalyzer.model.enums.Trend;
import com.jay.ptanalyzer.model.enums.VolatilityLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.jay.ptanalyzer.PriceSeriesFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class TrendVolatilityClassifierTest {

    private final TrendVolatilityClassifier classifier =
        new TrendVolatilityClassifier(new IndicatorLibrary(), new AnalysisConfig());

    @Nested
    @DisplayName("classifyTrend()")
    class TrendTests {

        @Test
        @DisplayName("fewer than 200 bars → neutral without averages")
        void shortSeries() {
            TrendState state = classifier.classifyTrend(linear(199, 100, 150));
            assertEquals(Trend.NEUTRAL, state.trend());
            assertNull(state.movingAverages());
        }

        @Test
        @DisplayName("strictly rising 250 bars → strong_uptrend")
        void strongUptrend() {
            TrendState state = classifier.classifyTrend(linear(250, 100, 150));

            assertEquals(Trend.STRONG_UPTREND, state.trend());
            assertEquals("strong_uptrend", state.trend().label());
            assertTrue(state.movingAverages().shortTerm() > state.movingAverages().mediumTerm());
            assertTrue(state.movingAverages().mediumTerm() > state.movingAverages().longTerm());
        }

        @Test
        @DisplayName("strictly falling 250 bars → strong_downtrend")
        void strongDowntrend() {
            assertEquals(Trend.STRONG_DOWNTREND, classifier.classifyTrend(linear(250, 150, 100)).trend());
        }

        @Test
        @DisplayName("recent rise over a long decline → uptrend (long SMA unconstrained)")
        void uptrendOverLongDecline() {
            // 200 falling bars then 60 rising: price > SMA20 > SMA50 but SMA50 < SMA200
            List<PriceBar> bars = new ArrayList<>(linear(200, 200, 100));
            List<PriceBar> rally = linear(61, 100, 130);
            for (int i = 1; i < rally.size(); i++) {
                PriceBar bar = rally.get(i);
                bar.setDate(bars.get(bars.size() - 1).getDate().plusDays(1));
                bars.add(bar);
            }

            TrendState state = classifier.classifyTrend(bars);
            assertEquals(Trend.UPTREND, state.trend());
            assertTrue(state.movingAverages().mediumTerm() < state.movingAverages().longTerm());
        }

        @Test
        @DisplayName("flat series → neutral with averages populated")
        void flatNeutral() {
            TrendState state = classifier.classifyTrend(flat(220, 80));
            assertEquals(Trend.NEUTRAL, state.trend());
            assertEquals(80.0, state.movingAverages().longTerm(), 1e-9);
        }
    }

    @Nested
    @DisplayName("classifyVolatility()")
    class VolatilityTests {

        @Test
        @DisplayName("fewer than 2 bars → zeroed low tier")
        void tooShort() {
            VolatilityState state = classifier.classifyVolatility(flat(1, 100));
            assertEquals(0.0, state.standardDeviation());
            assertEquals(0.0, state.annualizedVolatility());
            assertEquals(VolatilityLevel.LOW, state.currentLevel());
        }

        @Test
        @DisplayName("flat series → zero dispersion, low tier")
        void flatSeries() {
            VolatilityState state = classifier.classifyVolatility(flat(40, 100));
            assertEquals(0.0, state.standardDeviation());
            assertEquals(0.0, state.annualizedVolatility());
            assertEquals(VolatilityLevel.LOW, state.currentLevel());
        }

        @Test
        @DisplayName("smooth rise → low tier")
        void smoothRise() {
            assertEquals(VolatilityLevel.LOW, classifier.classifyVolatility(linear(250, 100, 150)).currentLevel());
        }

        @Test
        @DisplayName("±1.25% swings → medium tier")
        void mediumSwings() {
            VolatilityState state = classifier.classifyVolatility(alternating(40, 100, 101.25));
            assertEquals(VolatilityLevel.MEDIUM, state.currentLevel());
        }

        @Test
        @DisplayName("±10% swings → high tier")
        void wildSwings() {
            VolatilityState state = classifier.classifyVolatility(alternating(40, 100, 110));
            assertEquals(VolatilityLevel.HIGH, state.currentLevel());
        }

        @Test
        @DisplayName("annualized = σ × √252, σ with n-1 denominator")
        void annualization() {
            // returns: ln(1.1), ln(1/1.1) → mean 0, sample σ = ln(1.1) × √2
            VolatilityState state = classifier.classifyVolatility(fromCloses(100, 110, 100), 20);
            double expected = Math.log(1.1) * Math.sqrt(2);

            assertEquals(expected, state.standardDeviation(), 1e-12);
            assertEquals(expected * Math.sqrt(252), state.annualizedVolatility(), 1e-12);
        }

        @Test
        @DisplayName("only the most recent period closes are used")
        void windowed() {
            // wild early history, calm last 20 bars
            List<PriceBar> bars = new ArrayList<>(alternating(30, 100, 150));
            List<PriceBar> calm = flat(20, 150);
            for (PriceBar bar : calm) {
                bar.setDate(bars.get(bars.size() - 1).getDate().plusDays(1));
                bars.add(bar);
            }
            assertEquals(0.0, classifier.classifyVolatility(bars).annualizedVolatility());
        }
    }
}
