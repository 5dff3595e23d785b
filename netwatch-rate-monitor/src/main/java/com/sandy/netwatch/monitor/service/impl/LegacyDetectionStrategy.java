package com.sandy.netwatch.monitor.service.impl;

import com.sandy.netwatch.monitor.detection.DetectionRequest;
import com.sandy.netwatch.monitor.model.AnomalyEvent;
import com.sandy.netwatch.monitor.monitor.AnomalyHistory;
import com.sandy.netwatch.monitor.service.DetectionStrategy;

import java.util.Optional;

/**
 * Threshold-only mode: the detection manager is never consulted.
 */
public class LegacyDetectionStrategy implements DetectionStrategy {

    @Override
    public Optional<AnomalyEvent> evaluate(DetectionRequest request, AnomalyHistory history) {
        return Optional.empty();
    }

    @Override
    public String name() {
        return "legacy";
    }
}
