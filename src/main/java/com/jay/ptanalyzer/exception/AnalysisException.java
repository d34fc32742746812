package com.jay.ptanalyzer.exception;

public class AnalysisException extends RuntimeException {
    private final String symbol;

    public AnalysisException(String symbol, String message) {
        super("[" + symbol + "] " + message);
        this.symbol = symbol;
    }

    public AnalysisException(String symbol, String message, Throwable cause) {
        super("[" + symbol + "] " + message, cause);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
