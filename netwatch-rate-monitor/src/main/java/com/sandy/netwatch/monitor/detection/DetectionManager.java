package com.sandy.netwatch.monitor.detection;

import com.sandy.netwatch.monitor.model.AnomalyEvent;
import com.sandy.netwatch.monitor.model.AnomalyType;
import com.sandy.netwatch.monitor.model.DetectorConfig;
import com.sandy.netwatch.monitor.model.DetectorKind;
import com.sandy.netwatch.monitor.model.DetectorVerdict;
import com.sandy.netwatch.monitor.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs every detector kind on a sample and folds the verdicts into at most one {@link AnomalyEvent}.
 * <p>
 * {@code combined = min(1, sensitivity * sum(w * s) / sum(w))} over the detectors that fired; an event is
 * produced when {@code combined > reportThreshold}.
 * <p>
 * A fired detector scores at least 0.5, so with the default sensitivity and report threshold every event is
 * {@link Severity#MEDIUM} or above. {@link Severity#LOW} events need a report threshold below 0.4 and a
 * sensitivity under 1.
 */
@Component
@Slf4j
public class DetectionManager {

    private final Map<DetectorKind, AnomalyDetector> detectors = new EnumMap<>(DetectorKind.class);
    private final DetectorConfig config;

    public DetectionManager(List<AnomalyDetector> detectors, DetectorConfig config) {
        for (AnomalyDetector d : detectors) {
            AnomalyDetector previous = this.detectors.put(d.kind(), d);
            if (previous != null) {
                throw new IllegalStateException("Two detectors of kind " + d.kind() + ": "
                        + previous.getClass().getSimpleName() + " and " + d.getClass().getSimpleName());
            }
        }
        for (DetectorKind kind : DetectorKind.values()) {
            if (!this.detectors.containsKey(kind)) {
                throw new IllegalStateException("No detector registered for kind " + kind);
            }
        }
        this.config = config;
    }

    public static DetectionManager withDefaultDetectors(DetectorConfig config) {
        return new DetectionManager(List.of(new ThresholdDetector(), new StatisticalDetector(),
                new TimeAwareDetector(), new TrendDetector()), config);
    }

    public DetectorConfig getConfig() {
        return config;
    }

    /** Verdicts of all detectors, in {@link DetectorKind} order. */
    public List<DetectorVerdict> verdicts(DetectionRequest request) {
        return detectors.values().stream().map(d -> d.evaluate(request, config)).toList();
    }

    public Optional<AnomalyEvent> detect(DetectionRequest request) {
        double weighted = 0;
        double weights = 0;
        EnumSet<AnomalyType> types = EnumSet.noneOf(AnomalyType.class);
        Map<DetectorKind, Double> scores = new EnumMap<>(DetectorKind.class);
        for (DetectorVerdict v : verdicts(request)) {
            if (!v.anomalous()) continue;
            double w = config.weightOf(v.kind());
            weighted += w * v.score();
            weights += w;
            types.addAll(v.types());
            scores.put(v.kind(), v.score());
            log.debug("Detector fired key={} kind={} score={} detail={}", request.key(), v.kind(), v.score(), v.detail());
        }
        if (types.isEmpty() || weights <= 0) {
            return Optional.empty();
        }
        double combined = Math.min(1.0, config.getSensitivity() * weighted / weights);
        if (combined <= config.getReportThreshold()) {
            log.debug("Below report threshold key={} combined={} types={}", request.key(), combined, types);
            return Optional.empty();
        }
        return Optional.of(AnomalyEvent.builder()
                .timestamp(request.sample().timestamp())
                .key(request.key())
                .value(request.sample().value())
                .triggeredTypes(Collections.unmodifiableSet(types))
                .confidence(combined)
                .severity(Severity.fromScore(combined))
                .detectorScores(scores)
                .build());
    }
}
