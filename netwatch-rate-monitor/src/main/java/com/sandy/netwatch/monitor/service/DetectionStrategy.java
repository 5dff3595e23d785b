package com.sandy.netwatch.monitor.service;

import com.sandy.netwatch.monitor.detection.DetectionRequest;
import com.sandy.netwatch.monitor.model.AnomalyEvent;
import com.sandy.netwatch.monitor.monitor.AnomalyHistory;

import java.util.Optional;

/**
 * Anomaly detection applied on every tick, chosen once at startup. The plain threshold rule runs outside of
 * this strategy and is the same in every mode.
 */
public interface DetectionStrategy {

    /**
     * @param history the key's anomaly history, appended to when an event is produced
     */
    Optional<AnomalyEvent> evaluate(DetectionRequest request, AnomalyHistory history);

    String name();
}
