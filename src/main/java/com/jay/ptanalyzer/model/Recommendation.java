package com.jay.ptanalyzer.model;

import com.jay.ptanalyzer.model.enums.RecommendationAction;

/**
 * @param expectedReturn target vs current price delta, in percent
 */
public record Recommendation(RecommendationAction action, String reasoning, double expectedReturn) {}
