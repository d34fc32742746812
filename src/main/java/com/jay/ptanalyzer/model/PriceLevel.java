package com.jay.ptanalyzer.model;

/**
 * A recurring price level. {@code index} is the bar where the level was found.
 */
public record PriceLevel(double price, int touchCount, int index) {}
