package com.jay.ptanalyzer.layer1_indicators;

import org.ta4j.core.indicators.CachedIndicator;
import org.ta4j.core.num.Num;

/** Fast EMA minus slow EMA; NaN until the slow EMA is seeded. */
class MacdLineIndicator extends CachedIndicator<Num> {

    private final SeededAverageIndicator fast;
    private final SeededAverageIndicator slow;

    MacdLineIndicator(SeededAverageIndicator fast, SeededAverageIndicator slow) {
        super(fast.getBarSeries());
        this.fast = fast;
        this.slow = slow;
    }

    @Override
    protected Num calculate(int index) {
        return fast.getValue(index).minus(slow.getValue(index));
    }

    public int getUnstableBars() {
        return slow.getUnstableBars();
    }
}
