package com.jay.ptanalyzer.model;

import lombok.Builder;
import lombok.Value;

/**
 * Analyst consensus figures from an external provider.
 * Passed through to the analysis record unvalidated; every field may be null.
 */
@Value
@Builder
public class AnalystConsensus {
    Double  targetMeanPrice;
    Double  targetMedianPrice;
    Double  targetHighPrice;
    Double  targetLowPrice;
    String  recommendationKey;    // e.g. "buy", "hold"
    Double  recommendationMean;   // 1 = strong buy ... 5 = sell
    Integer numberOfAnalystOpinions;
}
