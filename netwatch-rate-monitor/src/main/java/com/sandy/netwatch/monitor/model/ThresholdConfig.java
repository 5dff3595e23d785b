package com.sandy.netwatch.monitor.model;

/**
 * Plain threshold rule for one monitored key: alarm after {@code consecutiveDuration}
 * consecutive samples above {@code maxValue}.
 */
public record ThresholdConfig(String monitoredKey,
                              long intervalSeconds,
                              double maxValue,
                              int consecutiveDuration,
                              int maxSamples) {
}
