package com.jay.ptanalyzer.model.enums;

public enum TargetMethod {
    WEIGHTED_AVERAGE("weighted_average"),
    CURRENT_PRICE("current_price");

    private final String label;

    TargetMethod(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
