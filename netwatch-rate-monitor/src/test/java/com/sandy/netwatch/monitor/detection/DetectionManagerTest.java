package com.sandy.netwatch.monitor.detection;

import com.sandy.netwatch.monitor.model.AnomalyEvent;
import com.sandy.netwatch.monitor.model.AnomalyType;
import com.sandy.netwatch.monitor.model.DetectorConfig;
import com.sandy.netwatch.monitor.model.DetectorKind;
import com.sandy.netwatch.monitor.model.Sample;
import com.sandy.netwatch.monitor.model.Severity;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DetectionManagerTest {

    private static final long T0 = 1_700_000_000L;

    private static final DetectorConfig BASE = DetectorConfig.builder().zone(ZoneOffset.UTC).build();

    /** Only the threshold and statistical detectors can speak. */
    private static final DetectorConfig TWO_DETECTORS = BASE.toBuilder()
            .minBucketHistory(1000)
            .trendWindow(1000)
            .build();

    private static List<Sample> flat(double value, int n) {
        List<Sample> out = new ArrayList<>();
        for (int i = 0; i < n; i++) out.add(new Sample(T0 + i, value));
        return out;
    }

    private static List<Sample> meanTenStddevTwo() {
        double a = Math.sqrt(4.5);
        double[] values = {10 + a, 10 - a, 10 + a, 10 - a, 10 + a, 10 - a, 10 + a, 10 - a, 10, 10};
        List<Sample> out = new ArrayList<>();
        for (int i = 0; i < values.length; i++) out.add(new Sample(T0 + i, values[i]));
        return out;
    }

    private static DetectionRequest request(double value, double max, List<Sample> history) {
        return new DetectionRequest("total:s", new Sample(T0 + 100, value), history, max);
    }

    @Test
    void quietSampleProducesNothing() {
        DetectionManager manager = DetectionManager.withDefaultDetectors(BASE);
        assertTrue(manager.detect(request(5, 20, flat(5, 12))).isEmpty());
        assertEquals(4, manager.verdicts(request(5, 20, flat(5, 12))).size());
    }

    @Test
    void floodTriggersEveryCategory() {
        DetectionManager manager = DetectionManager.withDefaultDetectors(BASE);
        AnomalyEvent event = manager.detect(request(100, 20, flat(5, 12))).orElseThrow();

        assertEquals(1.0, event.getConfidence(), 1e-9);
        assertEquals(Severity.CRITICAL, event.getSeverity());
        assertTrue(event.getTriggeredTypes().containsAll(List.of(AnomalyType.THRESHOLD, AnomalyType.SPIKE,
                AnomalyType.STATISTICAL, AnomalyType.TIME_PATTERN, AnomalyType.INCREASING_TREND)));
        assertEquals(4, event.getDetectorScores().size());
        assertEquals(T0 + 100, event.getTimestamp());
        assertEquals("total:s", event.getKey());
    }

    @Test
    void combinedScoreIsWeightedAverageOfFiredDetectors() {
        // threshold 17/10 -> 0.85, statistical z=3.5 -> 0.5833
        DetectionRequest req = request(17, 10, meanTenStddevTwo());
        double threshold = 0.85;
        double statistical = 3.5 / 3.0 / 2.0;

        AnomalyEvent equal = DetectionManager.withDefaultDetectors(TWO_DETECTORS).detect(req).orElseThrow();
        assertEquals((threshold + statistical) / 2, equal.getConfidence(), 1e-9);
        assertEquals(Severity.HIGH, equal.getSeverity());

        DetectorConfig weighted = TWO_DETECTORS.toBuilder().weight(DetectorKind.THRESHOLD, 3.0).build();
        AnomalyEvent skewed = DetectionManager.withDefaultDetectors(weighted).detect(req).orElseThrow();
        assertEquals((3 * threshold + statistical) / 4, skewed.getConfidence(), 1e-9);
    }

    @Test
    void justAboveTheLimitIsReported() {
        DetectionManager manager = DetectionManager.withDefaultDetectors(TWO_DETECTORS);
        Optional<AnomalyEvent> event = manager.detect(request(20.5, 20, Collections.emptyList()));
        assertTrue(event.isPresent());
        assertEquals(Severity.MEDIUM, event.get().getSeverity());
        assertTrue(manager.detect(request(20, 20, Collections.emptyList())).isEmpty());
    }

    @Test
    void sensitivityScalesTheCombinedScore() {
        DetectionManager dull = DetectionManager.withDefaultDetectors(TWO_DETECTORS.toBuilder().sensitivity(0.9).build());
        assertTrue(dull.detect(request(21, 20, Collections.emptyList())).isEmpty());

        DetectionManager sharp = DetectionManager.withDefaultDetectors(TWO_DETECTORS.toBuilder().sensitivity(2.0).build());
        assertEquals(1.0, sharp.detect(request(21, 20, Collections.emptyList())).orElseThrow().getConfidence(), 1e-9);
    }

    @Test
    void lowSeverityNeedsALowerReportThreshold() {
        DetectionRequest req = request(21, 20, Collections.emptyList());
        DetectorConfig damped = TWO_DETECTORS.toBuilder().sensitivity(0.6).build();
        assertTrue(DetectionManager.withDefaultDetectors(damped).detect(req).isEmpty());

        DetectionManager lenient = DetectionManager.withDefaultDetectors(damped.toBuilder().reportThreshold(0.2).build());
        AnomalyEvent event = lenient.detect(req).orElseThrow();
        assertEquals(0.6 * 21.0 / 20.0 / 2.0, event.getConfidence(), 1e-9);
        assertEquals(Severity.LOW, event.getSeverity());
    }

    @Test
    void triggeredTypesCannotBeModified() {
        AnomalyEvent event = DetectionManager.withDefaultDetectors(BASE).detect(request(100, 20, flat(5, 12))).orElseThrow();
        assertThrows(UnsupportedOperationException.class, () -> event.getTriggeredTypes().add(AnomalyType.SPIKE));
    }

    @Test
    void everyKindMustBeRegisteredOnce() {
        assertThrows(IllegalStateException.class, () -> new DetectionManager(
                List.of(new ThresholdDetector(), new StatisticalDetector(), new TrendDetector()), BASE));
        assertThrows(IllegalStateException.class, () -> new DetectionManager(
                List.of(new ThresholdDetector(), new ThresholdDetector(), new StatisticalDetector(),
                        new TimeAwareDetector(), new TrendDetector()), BASE));
    }

    @Test
    void historyMustPrecedeTheSample() {
        assertThrows(IllegalArgumentException.class,
                () -> new DetectionRequest("k", new Sample(T0, 1), List.of(new Sample(T0, 1)), 10));
    }
}
