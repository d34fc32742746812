package com.jay.ptanalyzer.model.enums;

/** Origin of a weighted target-price candidate. */
public enum TargetSource {
    BOLLINGER_UPPER("bollinger_upper"),
    BOLLINGER_MIDDLE("bollinger_middle"),
    FIBONACCI_UP("fibonacci_up"),
    FIBONACCI_DOWN("fibonacci_down"),
    RESISTANCE("resistance"),
    SUPPORT("support"),
    MA_PROJECTION_UP("ma_projection_up"),
    MA_PROJECTION_DOWN("ma_projection_down");

    private final String label;

    TargetSource(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
