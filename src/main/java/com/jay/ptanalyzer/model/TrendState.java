package com.jay.ptanalyzer.model;

import com.jay.ptanalyzer.model.enums.Trend;

public record TrendState(Trend trend, MovingAverages movingAverages) {

    public static TrendState neutral() {
        return new TrendState(Trend.NEUTRAL, null);
    }
}
