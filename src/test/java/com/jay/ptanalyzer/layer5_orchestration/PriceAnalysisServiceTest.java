package com.jay.ptanalyzer.layer5_orchestration;

import com.jay.ptanalyzer.config.AnalysisConfig;
import com.jay.ptanalyzer.exception.AnalysisException;
import com.jay.ptanalyzer.exception.NoDataAvailableException;
import com.jay.ptanalyzer.layer1_indicators.IndicatorLibrary;
import com.jay.ptanalyzer.layer2_analysis.LevelDetector;
import com.jay.ptanalyzer.layer2_analysis.TrendVolatilityClassifier;
import com.jay.ptanalyzer.layer3_target.ConfidenceScorer;
import com.jay.ptanalyzer.layer3_target.TargetPriceSynthesizer;
import com.jay.ptanalyzer.layer4_signal.RecommendationEngine;
import com.jay.ptanalyzer.model.AnalysisRecord;
import com.jay.ptanalyzer.model.AnalystConsensus;
import com.jay.ptanalyzer.model.BollingerPoint;
import com.jay.ptanalyzer.model.PriceBar;
import com.jay.ptanalyzer.model.QuoteSnapshot;
import com.jay.ptanalyzer.model.enums.ConfidenceLevel;
import com.jay.ptanalyzer.model.enums.RecommendationAction;
import com.jay.ptanalyzer.model.enums.TargetMethod;
import com.jay.ptanalyzer.model.enums.Trend;
import com.jay.ptanalyzer.model.enums.VolatilityLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.jay.ptanalyzer.PriceSeriesFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class PriceAnalysisServiceTest {

    private final PriceAnalysisService service = newService(new AnalysisConfig());

    static PriceAnalysisService newService(AnalysisConfig config) {
        IndicatorLibrary indicators = new IndicatorLibrary();
        return new PriceAnalysisService(
            indicators,
            new LevelDetector(config),
            new TrendVolatilityClassifier(indicators, config),
            new TargetPriceSynthesizer(config),
            new ConfidenceScorer(config),
            new RecommendationEngine(config),
            config);
    }

    @Nested
    @DisplayName("input validation")
    class ValidationTests {

        @Test
        @DisplayName("empty series → NoDataAvailableException carrying the symbol")
        void emptySeries() {
            NoDataAvailableException ex = assertThrows(NoDataAvailableException.class,
                () -> service.analyse("ACME", List.of()));
            assertEquals("ACME", ex.getSymbol());
            assertTrue(ex.getMessage().contains("No data available"));
        }

        @Test
        @DisplayName("null series → NoDataAvailableException, an AnalysisException")
        void nullSeries() {
            assertThrows(AnalysisException.class, () -> service.analyse("ACME", null));
        }
    }

    @Nested
    @DisplayName("stage gating")
    class GatingTests {

        @Test
        @DisplayName("10 bars → every stage at its default, price falls back to last close")
        void tinySeries() {
            AnalysisRecord record = service.analyse("TINY", linear(10, 40, 50));

            assertNull(record.getIndicators());
            assertNull(record.getCalculations().technical());
            assertNull(record.getCalculations().fibonacci());
            assertTrue(record.getCalculations().supportResistance().support().isEmpty());
            assertTrue(record.getCalculations().supportResistance().resistance().isEmpty());
            assertEquals(Trend.NEUTRAL, record.getCalculations().trend().trend());
            assertEquals(0.0, record.getCalculations().volatility().annualizedVolatility());
            assertEquals(VolatilityLevel.LOW, record.getCalculations().volatility().currentLevel());

            assertEquals(TargetMethod.CURRENT_PRICE, record.getAnalysisMethod());
            assertEquals(50.0, record.getTargetPrice(), 1e-9);
            assertEquals(45.0, record.getPriceRangeLow(), 1e-9);
            assertEquals(55.0, record.getPriceRangeHigh(), 1e-9);
            // 50 - 10 (rsi) - 15 (trend) + 10 (volatility) - 10 (levels) - 20 (samples)
            assertEquals(5, record.getConfidenceScore());
            assertEquals(ConfidenceLevel.LOW, record.getConfidenceLevel());
            assertEquals(RecommendationAction.HOLD, record.getRecommendation().action());
        }

        @Test
        @DisplayName("30 bars → volatility measured, indicators and levels still skipped")
        void belowIndicatorGate() {
            AnalysisRecord record = service.analyse("MID", alternating(30, 100, 110));

            assertNull(record.getIndicators());
            assertNull(record.getCalculations().fibonacci());
            assertEquals(VolatilityLevel.HIGH, record.getCalculations().volatility().currentLevel());
        }

        @Test
        @DisplayName("250 rising bars → strong uptrend, weighted target, full confidence")
        void longRisingSeries() {
            List<PriceBar> bars = linear(250, 100, 150);
            AnalysisRecord record = service.analyse("RISE", bars);

            assertNotNull(record.getIndicators());
            assertEquals(231, record.getIndicators().getSma20().size());
            assertNotNull(record.getCalculations().fibonacci());
            assertEquals(Trend.STRONG_UPTREND, record.getCalculations().trend().trend());
            assertEquals(VolatilityLevel.LOW, record.getCalculations().volatility().currentLevel());
            assertEquals(TargetMethod.WEIGHTED_AVERAGE, record.getAnalysisMethod());
            assertFalse(record.getTargetBreakdown().isEmpty());
            assertTrue(record.getPriceRangeLow() < record.getTargetPrice());
            assertTrue(record.getPriceRangeHigh() > record.getTargetPrice());
            assertEquals(100, record.getConfidenceScore());
            assertEquals(ConfidenceLevel.HIGH, record.getConfidenceLevel());

            double expectedDelta = (record.getTargetPrice() - 150) / 150 * 100;
            assertEquals(expectedDelta, record.getRecommendation().expectedReturn(), 1e-9);
        }
    }

    @Nested
    @DisplayName("record assembly")
    class AssemblyTests {

        @Test
        @DisplayName("flat series → collapsed bands, zero volatility, target at the mean")
        void flatSeries() {
            AnalysisRecord record = service.analyse("FLAT", flat(60, 100));

            BollingerPoint bb = record.getIndicators().latestBollinger();
            assertEquals(100.0, bb.upperBand(), 1e-9);
            assertEquals(100.0, bb.lowerBand(), 1e-9);
            assertEquals(0.0, bb.percentB());
            assertEquals(0.0, record.getCalculations().volatility().annualizedVolatility());
            assertEquals(100.0, record.getTargetPrice(), 1e-9);
            // zero volatility → percentage fallback range
            assertEquals(90.0, record.getPriceRangeLow(), 1e-9);
            assertEquals(110.0, record.getPriceRangeHigh(), 1e-9);
        }

        @Test
        @DisplayName("quote drives current price and change; consensus passes through")
        void quoteAndConsensus() {
            QuoteSnapshot quote = QuoteSnapshot.builder().price(160).previousClose(150).volume(2_500_000L).build();
            AnalystConsensus consensus = AnalystConsensus.builder()
                .targetMeanPrice(175.0)
                .recommendationKey("buy")
                .numberOfAnalystOpinions(12)
                .build();

            AnalysisRecord record = service.analyse("QUOTE", flat(60, 100), quote, consensus);

            assertEquals("QUOTE", record.getSymbol());
            assertEquals(160.0, record.getCurrentPrice());
            assertEquals(10.0, record.getPriceChange(), 1e-9);
            assertEquals(100.0 / 15, record.getPriceChangePercent(), 1e-9);
            assertEquals(2_500_000L, record.getVolume());
            assertSame(consensus, record.getAnalystConsensus());
            // target stays anchored on the last close, the delta uses the quote
            assertEquals(100.0, record.getTargetPrice(), 1e-9);
            assertEquals(-37.5, record.getRecommendation().expectedReturn(), 1e-9);
        }

        @Test
        @DisplayName("without a quote → last close, zero change and volume, no consensus")
        void noQuote() {
            AnalysisRecord record = service.analyse("BARE", linear(60, 80, 90));

            assertEquals(90.0, record.getCurrentPrice(), 1e-9);
            assertEquals(0.0, record.getPriceChange());
            assertEquals(0.0, record.getPriceChangePercent());
            assertEquals(0L, record.getVolume());
            assertNull(record.getAnalystConsensus());
            assertEquals(LocalDate.now(), record.getAnalysisDate());
        }

        @Test
        @DisplayName("same input twice → identical records apart from the date")
        void deterministic() {
            List<PriceBar> bars = wave(220);
            AnalysisRecord first = service.analyse("WAVE", bars).toBuilder().analysisDate(null).build();
            AnalysisRecord second = service.analyse("WAVE", bars).toBuilder().analysisDate(null).build();
            assertEquals(first, second);
        }
    }
}
