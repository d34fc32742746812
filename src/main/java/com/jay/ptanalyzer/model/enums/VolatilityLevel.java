package com.jay.ptanalyzer.model.enums;

public enum VolatilityLevel {
    LOW,
    MEDIUM,
    HIGH
}
