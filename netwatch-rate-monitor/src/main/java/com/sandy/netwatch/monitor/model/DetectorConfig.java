package com.sandy.netwatch.monitor.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.ZoneId;
import java.util.Map;

/**
 * Tuning shared by every detector instance.
 */
@Value
@Builder(toBuilder = true)
public class DetectorConfig {
    @Builder.Default
    double sensitivity = 1.0;
    @Builder.Default
    double spikeSensitivity = 2.0;
    /** Prior samples averaged for the spike baseline. */
    @Builder.Default
    int spikeLookback = 4;
    @Builder.Default
    double zscoreThreshold = 3.0;
    @Builder.Default
    double trendThreshold = 0.2;
    @Builder.Default
    int trendWindow = 10;
    @Builder.Default
    int hourGranularity = 1;
    @Builder.Default
    int minHistory = 10;
    @Builder.Default
    int minBucketHistory = 3;
    /** Lower bound for the standard deviation used in z-scores. */
    @Builder.Default
    double stddevFloor = 0.1;
    @Builder.Default
    double reportThreshold = 0.5;
    @Builder.Default
    ZoneId zone = ZoneId.systemDefault();
    @Singular
    Map<DetectorKind, Double> weights;

    public double weightOf(DetectorKind kind) {
        Double w = weights.get(kind);
        return w == null ? 1.0 : w;
    }
}
