package com.jay.ptanalyzer.layer1_indicators;

import org.ta4j.core.Indicator;
import org.ta4j.core.indicators.RecursiveCachedIndicator;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.num.NaN;
import org.ta4j.core.num.Num;

/**
 * Exponentially weighted average seeded with the simple mean of its first
 * {@code barCount} valid inputs, then {@code prev + (value - prev) × multiplier}.
 * Multiplier 2/(n+1) is the standard EMA, 1/n is Wilder smoothing.
 *
 * Values before the seed bar are NaN.
 */
class SeededAverageIndicator extends RecursiveCachedIndicator<Num> {

    private final Indicator<Num> indicator;
    private final SMAIndicator seed;
    private final int seedIndex;
    private final Num multiplier;

    private SeededAverageIndicator(Indicator<Num> indicator, int barCount, double multiplier, int firstValidIndex) {
        super(indicator.getBarSeries());
        this.indicator = indicator;
        this.seed = new SMAIndicator(indicator, barCount);
        this.seedIndex = firstValidIndex + barCount - 1;
        this.multiplier = indicator.getBarSeries().numOf(multiplier);
    }

    /** EMA over an input that is valid from {@code firstValidIndex} on. */
    static SeededAverageIndicator ema(Indicator<Num> indicator, int barCount, int firstValidIndex) {
        return new SeededAverageIndicator(indicator, barCount, 2.0 / (barCount + 1), firstValidIndex);
    }

    static SeededAverageIndicator wilder(Indicator<Num> indicator, int barCount, int firstValidIndex) {
        return new SeededAverageIndicator(indicator, barCount, 1.0 / barCount, firstValidIndex);
    }

    /** First bar index carrying a value. */
    int seedIndex() {
        return seedIndex;
    }

    @Override
    protected Num calculate(int index) {
        if (index < seedIndex) {
            return NaN.NaN;
        }
        if (index == seedIndex) {
            return seed.getValue(index);
        }
        Num prev = getValue(index - 1);
        return indicator.getValue(index).minus(prev).multipliedBy(multiplier).plus(prev);
    }

    public int getUnstableBars() {
        return seedIndex;
    }
}
