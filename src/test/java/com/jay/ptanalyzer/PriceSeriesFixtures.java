package com.jay.ptanalyzer;

import com.jay.ptanalyzer.model.PriceBar;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Synthetic daily series for tests. Highs/lows sit 1% around the close.
 */
public final class PriceSeriesFixtures {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    private PriceSeriesFixtures() {}

    /** {@code count} closes rising linearly from {@code from} to {@code to}. */
    public static List<PriceBar> linear(int count, double from, double to) {
        double[] closes = new double[count];
        for (int i = 0; i < count; i++) {
            closes[i] = count == 1 ? from : from + (to - from) * i / (count - 1);
        }
        return fromCloses(closes);
    }

    public static List<PriceBar> flat(int count, double price) {
        double[] closes = new double[count];
        Arrays.fill(closes, price);
        return fromCloses(closes);
    }

    /** Closes alternating between {@code a} and {@code b}, starting with {@code a}. */
    public static List<PriceBar> alternating(int count, double a, double b) {
        double[] closes = new double[count];
        for (int i = 0; i < count; i++) closes[i] = i % 2 == 0 ? a : b;
        return fromCloses(closes);
    }

    /** Smooth wave around 100 with amplitude 10 and a 16 bar cycle. */
    public static List<PriceBar> wave(int count) {
        double[] closes = new double[count];
        for (int i = 0; i < count; i++) closes[i] = 100 + 10 * Math.sin(i * Math.PI / 8);
        return fromCloses(closes);
    }

    public static List<PriceBar> fromCloses(double... closes) {
        List<PriceBar> bars = new ArrayList<>(closes.length);
        for (int i = 0; i < closes.length; i++) {
            double close = closes[i];
            bars.add(PriceBar.builder()
                .date(START.plusDays(i))
                .open(close)
                .high(close * 1.01)
                .low(close * 0.99)
                .close(close)
                .volume(1_000_000L)
                .build());
        }
        return bars;
    }
}
