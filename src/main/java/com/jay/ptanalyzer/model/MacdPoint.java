package com.jay.ptanalyzer.model;

/**
 * One MACD reading. {@code signalLine} and {@code histogram} are null for the first
 * eight points, until the signal EMA has a full window of MACD values.
 */
public record MacdPoint(double macdLine, Double signalLine, Double histogram) {}
