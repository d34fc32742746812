package com.jay.ptanalyzer.layer1_indicators;

import com.jay.ptanalyzer.model.BollingerPoint;
import com.jay.ptanalyzer.model.IndicatorSet;
import com.jay.ptanalyzer.model.MacdPoint;
import com.jay.ptanalyzer.model.PriceBar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.Indicator;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.helpers.GainIndicator;
import org.ta4j.core.indicators.helpers.LossIndicator;
import org.ta4j.core.indicators.statistics.StandardDeviationIndicator;
import org.ta4j.core.num.Num;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Layer 1 — Indicator Library.
 * Stateless technical indicators over an oldest-first daily bar series.
 * SMA, Bollinger bands (population σ) and the price-change helpers come from ta4j.
 * EMA, RSI and the MACD signal use {@link SeededAverageIndicator}, which starts from
 * the simple mean of the first full window. ADX is computed directly because every
 * stage here is smoothed with a plain SMA rather than Wilder's average.
 *
 * Every indicator is gated on its own minimum length and returns null when unmet.
 * Sequences are oldest value first and start at the first bar with a full window.
 */
@Slf4j
@Component
public class IndicatorLibrary {

    public static final int MIN_BARS = 20;

    public static final int SMA_SHORT = 20;
    public static final int SMA_MEDIUM = 50;
    public static final int SMA_LONG = 200;
    public static final int EMA_FAST = 12;
    public static final int EMA_SLOW = 26;
    public static final int MACD_SIGNAL = 9;
    public static final int RSI_PERIOD = 14;
    public static final int BOLLINGER_PERIOD = 20;
    public static final double BOLLINGER_K = 2.0;
    public static final int ADX_PERIOD = 14;

    /**
     * Computes the full indicator set.
     * Returns null when the series has fewer than {@link #MIN_BARS} bars.
     */
    public IndicatorSet computeIndicators(List<PriceBar> bars) {
        if (bars == null || bars.size() < MIN_BARS) {
            log.debug("Indicator set skipped: {} bars < {}", bars == null ? 0 : bars.size(), MIN_BARS);
            return null;
        }

        BarSeries series = buildSeries(bars);
        ClosePriceIndicator close = new ClosePriceIndicator(series);
        int n = bars.size();

        return IndicatorSet.builder()
            .sma20(n >= SMA_SHORT ? sma(close, SMA_SHORT) : null)
            .sma50(n >= SMA_MEDIUM ? sma(close, SMA_MEDIUM) : null)
            .sma200(n >= SMA_LONG ? sma(close, SMA_LONG) : null)
            .ema12(n >= EMA_FAST ? ema(close, EMA_FAST) : null)
            .ema26(n >= EMA_SLOW ? ema(close, EMA_SLOW) : null)
            .rsi(n >= RSI_PERIOD ? rsi(close, RSI_PERIOD) : null)
            .macd(n >= EMA_SLOW ? macd(close) : null)
            .bollinger(n >= BOLLINGER_PERIOD ? bollinger(close, BOLLINGER_PERIOD, BOLLINGER_K) : null)
            .adx(n >= ADX_PERIOD ? adx(bars, ADX_PERIOD) : null)
            .build();
    }

    // ── Single indicators ─────────────────────────────────────────────────────

    /**
     * Trailing simple moving average of closes.
     * Always returns {@code max(0, size - period + 1)} values.
     */
    public List<Double> sma(List<PriceBar> bars, int period) {
        if (bars == null || bars.size() < period) return List.of();
        return sma(new ClosePriceIndicator(buildSeries(bars)), period);
    }

    /** Most recent SMA of closes, or NaN when the series is shorter than the period. */
    public double latestSma(List<PriceBar> bars, int period) {
        List<Double> values = sma(bars, period);
        return values.isEmpty() ? Double.NaN : values.get(values.size() - 1);
    }

    public List<Double> ema(List<PriceBar> bars, int period) {
        if (bars == null || bars.size() < period) return null;
        return ema(new ClosePriceIndicator(buildSeries(bars)), period);
    }

    public List<Double> rsi(List<PriceBar> bars, int period) {
        if (bars == null || bars.size() < period) return null;
        return rsi(new ClosePriceIndicator(buildSeries(bars)), period);
    }

    public List<MacdPoint> macd(List<PriceBar> bars) {
        if (bars == null || bars.size() < EMA_SLOW) return null;
        return macd(new ClosePriceIndicator(buildSeries(bars)));
    }

    public List<BollingerPoint> bollinger(List<PriceBar> bars, int period, double k) {
        if (bars == null || bars.size() < period) return null;
        return bollinger(new ClosePriceIndicator(buildSeries(bars)), period, k);
    }

    /**
     * Average Directional Index with every stage smoothed by a trailing SMA
     * (not Wilder smoothing). Zero denominators resolve to 0.
     */
    public List<Double> adx(List<PriceBar> bars, int period) {
        if (bars == null || bars.size() < period) return null;

        int n = bars.size();
        double[] trueRange = new double[n - 1];
        double[] plusDm = new double[n - 1];
        double[] minusDm = new double[n - 1];

        for (int i = 1; i < n; i++) {
            PriceBar cur = bars.get(i);
            PriceBar prev = bars.get(i - 1);
            double tr1 = Math.abs(cur.getHigh() - cur.getLow());
            double tr2 = Math.abs(cur.getHigh() - prev.getClose());
            double tr3 = Math.abs(cur.getLow() - prev.getClose());
            trueRange[i - 1] = Math.max(tr1, Math.max(tr2, tr3));

            double upMove = cur.getHigh() - prev.getHigh();
            double downMove = prev.getLow() - cur.getLow();
            plusDm[i - 1] = upMove > downMove && upMove > 0 ? upMove : 0;
            minusDm[i - 1] = downMove > upMove && downMove > 0 ? downMove : 0;
        }

        double[] atr = trailingMean(trueRange, period);
        double[] plusSmoothed = trailingMean(plusDm, period);
        double[] minusSmoothed = trailingMean(minusDm, period);

        double[] dx = new double[atr.length];
        for (int i = 0; i < atr.length; i++) {
            double plusDi = atr[i] != 0 ? plusSmoothed[i] * 100 / atr[i] : 0;
            double minusDi = atr[i] != 0 ? minusSmoothed[i] * 100 / atr[i] : 0;
            double diSum = plusDi + minusDi;
            dx[i] = diSum != 0 ? Math.abs(plusDi - minusDi) / diSum * 100 : 0;
        }
        return toList(trailingMean(dx, period));
    }

    // ── ta4j-backed computations ──────────────────────────────────────────────

    private List<Double> sma(Indicator<Num> close, int period) {
        return collect(new SMAIndicator(close, period), period - 1);
    }

    private List<Double> ema(Indicator<Num> close, int period) {
        return collect(SeededAverageIndicator.ema(close, period, 0), period - 1);
    }

    /**
     * Wilder RSI: gains and losses averaged over the first {@code period} price changes,
     * then Wilder-smoothed. First value is at bar {@code period}. No losses gives 100.
     */
    private List<Double> rsi(Indicator<Num> close, int period) {
        SeededAverageIndicator avgGain = SeededAverageIndicator.wilder(new GainIndicator(close), period, 1);
        SeededAverageIndicator avgLoss = SeededAverageIndicator.wilder(new LossIndicator(close), period, 1);
        int end = close.getBarSeries().getEndIndex();

        List<Double> values = new ArrayList<>();
        for (int i = avgGain.seedIndex(); i <= end; i++) {
            double gain = avgGain.getValue(i).doubleValue();
            double loss = avgLoss.getValue(i).doubleValue();
            double v = loss == 0 ? 100 : 100 - 100 / (1 + gain / loss);
            values.add(Math.max(0, Math.min(100, finite(v))));
        }
        return values;
    }

    /** Line from bar 25; the signal is an EMA(9) of the line, so it starts eight points later. */
    private List<MacdPoint> macd(Indicator<Num> close) {
        SeededAverageIndicator fast = SeededAverageIndicator.ema(close, EMA_FAST, 0);
        SeededAverageIndicator slow = SeededAverageIndicator.ema(close, EMA_SLOW, 0);
        MacdLineIndicator line = new MacdLineIndicator(fast, slow);
        SeededAverageIndicator signal = SeededAverageIndicator.ema(line, MACD_SIGNAL, slow.seedIndex());
        int end = close.getBarSeries().getEndIndex();

        List<MacdPoint> points = new ArrayList<>();
        for (int i = slow.seedIndex(); i <= end; i++) {
            double macdLine = finite(line.getValue(i).doubleValue());
            if (i < signal.seedIndex()) {
                points.add(new MacdPoint(macdLine, null, null));
            } else {
                double sig = finite(signal.getValue(i).doubleValue());
                points.add(new MacdPoint(macdLine, sig, macdLine - sig));
            }
        }
        return points;
    }

    /** Middle = SMA, bands = middle ± k·σ (population). Collapsed bands give %B 0. */
    private List<BollingerPoint> bollinger(Indicator<Num> close, int period, double k) {
        SMAIndicator middle = new SMAIndicator(close, period);
        StandardDeviationIndicator stdDev = new StandardDeviationIndicator(close, period);
        int end = close.getBarSeries().getEndIndex();

        List<BollingerPoint> points = new ArrayList<>();
        for (int i = period - 1; i <= end; i++) {
            double mid = middle.getValue(i).doubleValue();
            double sd = stdDev.getValue(i).doubleValue();
            double upper = mid + k * sd;
            double lower = mid - k * sd;
            double width = upper - lower;
            double percentB = width != 0 ? (close.getValue(i).doubleValue() - lower) / width : 0;
            points.add(new BollingerPoint(upper, mid, lower, percentB));
        }
        return points;
    }

    private List<Double> collect(Indicator<Num> indicator, int fromIndex) {
        int end = indicator.getBarSeries().getEndIndex();
        List<Double> values = new ArrayList<>(Math.max(0, end - fromIndex + 1));
        for (int i = fromIndex; i <= end; i++) {
            values.add(indicator.getValue(i).doubleValue());
        }
        return values;
    }

    // ── Direct computations ───────────────────────────────────────────────────

    /** Trailing mean over a plain array; {@code length - period + 1} values, empty when too short. */
    static double[] trailingMean(double[] values, int period) {
        if (values.length < period) return new double[0];
        double[] out = new double[values.length - period + 1];
        for (int i = period - 1; i < values.length; i++) {
            double sum = 0;
            for (int j = i - period + 1; j <= i; j++) sum += values[j];
            out[i - period + 1] = sum / period;
        }
        return out;
    }

    private static double finite(double value) {
        return Double.isNaN(value) || Double.isInfinite(value) ? 0 : value;
    }

    private static List<Double> toList(double[] values) {
        List<Double> list = new ArrayList<>(values.length);
        for (double v : values) list.add(v);
        return list;
    }

    /**
     * Builds a ta4j BarSeries from the bars. Each bar closes at the end of its
     * trading date (UTC); ta4j only requires strictly increasing end times.
     */
    private BarSeries buildSeries(List<PriceBar> bars) {
        BarSeries series = new BaseBarSeriesBuilder().withName("daily").build();
        for (PriceBar bar : bars) {
            ZonedDateTime endTime = bar.getDate().plusDays(1).atStartOfDay(ZoneOffset.UTC);
            series.addBar(endTime, bar.getOpen(), bar.getHigh(), bar.getLow(), bar.getClose(), bar.getVolume());
        }
        return series;
    }
}
