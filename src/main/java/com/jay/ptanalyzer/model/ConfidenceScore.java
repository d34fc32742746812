package com.jay.ptanalyzer.model;

import com.jay.ptanalyzer.model.enums.ConfidenceLevel;

/** Heuristic 0-100 confidence behind a target price. */
public record ConfidenceScore(int score, ConfidenceLevel level) {}
