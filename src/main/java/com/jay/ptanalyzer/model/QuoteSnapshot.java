package com.jay.ptanalyzer.model;

import lombok.Builder;
import lombok.Value;

/**
 * Latest quote for a symbol, supplied by the caller's quote provider.
 */
@Value
@Builder
public class QuoteSnapshot {
    double price;
    double previousClose;
    long   volume;

    public double change() {
        return price - previousClose;
    }

    public double changePercent() {
        return previousClose != 0 ? change() / previousClose * 100 : 0;
    }
}
