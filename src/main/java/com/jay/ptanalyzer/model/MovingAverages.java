package com.jay.ptanalyzer.model;

/** Latest short (20), medium (50) and long (200) bar SMA of closes. */
public record MovingAverages(double shortTerm, double mediumTerm, double longTerm) {}
