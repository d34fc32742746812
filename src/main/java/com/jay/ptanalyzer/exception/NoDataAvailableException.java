package com.jay.ptanalyzer.exception;

/**
 * Raised when an analysis is requested for a symbol with an empty price series.
 * Fatal for that call; the caller decides whether to refresh data and retry.
 */
public class NoDataAvailableException extends AnalysisException {

    public NoDataAvailableException(String symbol) {
        super(symbol, "No data available for analysis");
    }
}
