package com.jay.ptanalyzer.model;

import com.jay.ptanalyzer.model.enums.TargetMethod;

import java.util.List;

public record PriceTarget(
    double price,
    TargetMethod method,
    double rangeLow,
    double rangeHigh,
    List<TargetCandidate> breakdown
) {}
