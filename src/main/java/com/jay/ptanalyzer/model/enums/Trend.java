package com.jay.ptanalyzer.model.enums;

public enum Trend {
    STRONG_UPTREND("strong_uptrend"),     // price > SMA20 > SMA50 > SMA200
    UPTREND("uptrend"),                   // price > SMA20 > SMA50
    NEUTRAL("neutral"),
    DOWNTREND("downtrend"),               // price < SMA20 < SMA50
    STRONG_DOWNTREND("strong_downtrend"); // price < SMA20 < SMA50 < SMA200

    private final String label;

    Trend(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isUptrend() {
        return this == STRONG_UPTREND || this == UPTREND;
    }

    public boolean isDowntrend() {
        return this == STRONG_DOWNTREND || this == DOWNTREND;
    }
}
