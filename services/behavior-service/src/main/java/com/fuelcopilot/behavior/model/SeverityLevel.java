package com.fuelcopilot.behavior.model;

/**
 * Severity of a behavior event, ordered from least to most severe
 */
public enum SeverityLevel {
    MINOR,
    MODERATE,
    SEVERE,
    CRITICAL;

    public boolean isAtLeast(SeverityLevel other) {
        return compareTo(other) >= 0;
    }
}
