package com.jay.ptanalyzer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * One daily OHLCV bar. Series are ordered oldest → newest with unique dates.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceBar {
    private LocalDate date;
    private double open;
    private double high;
    private double low;
    private double close;
    private long volume;
}
