package com.sandy.netwatch.monitor.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * Combined verdict of all detectors for one sample.
 */
@Value
@Builder
public class AnomalyEvent {
    long timestamp;
    String key;
    double value;
    /** Every category whose detector fired, whatever its individual score. */
    Set<AnomalyType> triggeredTypes;
    /** Weighted combined score, 0..1. */
    double confidence;
    Severity severity;
    @Singular
    Map<DetectorKind, Double> detectorScores;
}
