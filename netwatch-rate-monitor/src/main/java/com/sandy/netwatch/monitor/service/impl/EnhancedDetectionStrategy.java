package com.sandy.netwatch.monitor.service.impl;

import com.sandy.netwatch.monitor.detection.DetectionManager;
import com.sandy.netwatch.monitor.detection.DetectionRequest;
import com.sandy.netwatch.monitor.model.AnomalyEvent;
import com.sandy.netwatch.monitor.monitor.AnomalyHistory;
import com.sandy.netwatch.monitor.service.DetectionStrategy;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

@RequiredArgsConstructor
public class EnhancedDetectionStrategy implements DetectionStrategy {

    private final DetectionManager detectionManager;

    @Override
    public Optional<AnomalyEvent> evaluate(DetectionRequest request, AnomalyHistory history) {
        Optional<AnomalyEvent> event = detectionManager.detect(request);
        event.ifPresent(history::record);
        return event;
    }

    @Override
    public String name() {
        return "enhanced";
    }
}
