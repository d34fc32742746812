package com.jay.ptanalyzer.model;

import com.jay.ptanalyzer.model.enums.TargetSource;

public record TargetCandidate(double price, double weight, TargetSource source) {}
