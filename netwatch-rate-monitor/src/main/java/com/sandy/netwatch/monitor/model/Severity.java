package com.sandy.netwatch.monitor.model;

/**
 * Discrete severity tier derived from a 0..1 confidence score.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static Severity fromScore(double score) {
        if (score >= 0.9) return CRITICAL;
        if (score >= 0.7) return HIGH;
        if (score >= 0.4) return MEDIUM;
        return LOW;
    }
}
