package com.jay.ptanalyzer.model.enums;

public enum ConfidenceLevel {
    LOW,
    MEDIUM,
    HIGH
}
