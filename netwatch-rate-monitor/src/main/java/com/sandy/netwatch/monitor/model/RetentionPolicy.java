package com.sandy.netwatch.monitor.model;

import java.time.Duration;

/**
 * Tiered retention rule for keys matching {@code keyPattern} ({@code *} and {@code ?} wildcards).
 */
public record RetentionPolicy(String name,
                              String keyPattern,
                              Duration rawRetention,
                              Duration resolution,
                              AggregationFunction function,
                              Duration archiveRetention) {

    public RetentionPolicy {
        if (keyPattern == null || keyPattern.isBlank()) {
            throw new IllegalArgumentException("Retention policy " + name + " has no key pattern");
        }
        if (rawRetention == null || rawRetention.isNegative() || rawRetention.isZero()) {
            throw new IllegalArgumentException("Retention policy " + name + " raw retention must be > 0");
        }
        if (resolution == null || resolution.getSeconds() <= 0) {
            throw new IllegalArgumentException("Retention policy " + name + " resolution must be >= 1s");
        }
        if (function == null) {
            throw new IllegalArgumentException("Retention policy " + name + " has no aggregation function");
        }
        if (archiveRetention == null || archiveRetention.compareTo(rawRetention) < 0) {
            throw new IllegalArgumentException("Retention policy " + name + " archive retention must be >= raw retention");
        }
    }
}
