package com.jay.ptanalyzer.model;

/**
 * One Bollinger band sample. {@code percentB} is 0 when the band has zero width.
 */
public record BollingerPoint(double upperBand, double middleBand, double lowerBand, double percentB) {}
