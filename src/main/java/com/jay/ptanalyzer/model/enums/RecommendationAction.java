package com.jay.ptanalyzer.model.enums;

public enum RecommendationAction {
    STRONG_BUY("STRONG BUY"),
    BUY("BUY"),
    HOLD("HOLD"),
    SELL("SELL"),
    STRONG_SELL("STRONG SELL");

    private final String label;

    RecommendationAction(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
