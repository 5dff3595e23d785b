package com.sandy.netwatch.monitor.detection;

import com.sandy.netwatch.monitor.model.AnomalyType;
import com.sandy.netwatch.monitor.model.DetectorConfig;
import com.sandy.netwatch.monitor.model.DetectorVerdict;
import com.sandy.netwatch.monitor.model.Sample;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TimeAwareDetectorTest {

    private final TimeAwareDetector detector = new TimeAwareDetector();
    private final DetectorConfig config = DetectorConfig.builder().zone(ZoneOffset.UTC).minBucketHistory(3).build();

    private static long at(int day, int hour) {
        return ZonedDateTime.of(2024, 3, day, hour, 0, 0, 0, ZoneOffset.UTC).toEpochSecond();
    }

    /** Busy afternoons (~100 at 15:00) and quiet nights (~2 at 03:00) over several days. */
    private static List<Sample> diurnalHistory() {
        List<Sample> out = new ArrayList<>();
        double[] jitter = {-1, 0, 1, 0.5, -0.5};
        for (int day = 1; day <= 5; day++) {
            out.add(new Sample(at(day, 3), 2 + jitter[day - 1]));
            out.add(new Sample(at(day, 15), 100 + jitter[day - 1]));
        }
        return out;
    }

    private DetectorVerdict eval(long ts, double value, List<Sample> history) {
        return detector.evaluate(new DetectionRequest("k", new Sample(ts, value), history, 1e9), config);
    }

    @Test
    void afternoonLevelIsNormalInTheAfternoon() {
        assertFalse(eval(at(6, 15), 100, diurnalHistory()).anomalous());
    }

    @Test
    void afternoonLevelAtNightIsATimePatternAnomaly() {
        DetectorVerdict v = eval(at(6, 3), 100, diurnalHistory());
        assertTrue(v.anomalous());
        assertEquals(Set.of(AnomalyType.TIME_PATTERN), v.types());
        assertEquals(1.0, v.score(), 1e-9);
    }

    @Test
    void bucketWithTooFewPointsAbstains() {
        DetectorVerdict v = eval(at(6, 9), 1000, diurnalHistory());
        assertFalse(v.anomalous());
        assertTrue(v.detail().contains("has 0 points"));
    }

    @Test
    void granularityWidensBuckets() {
        DetectorConfig sixHours = config.toBuilder().hourGranularity(6).build();
        // 05:00 shares the 00:00-05:59 bucket with the 03:00 history
        DetectorVerdict v = detector.evaluate(new DetectionRequest("k", new Sample(at(6, 5), 100), diurnalHistory(), 1e9), sixHours);
        assertTrue(v.anomalous());
        assertEquals(0, TimeAwareDetector.bucketOf(at(6, 5), ZoneOffset.UTC, 6));
        assertEquals(2, TimeAwareDetector.bucketOf(at(6, 15), ZoneOffset.UTC, 6));
    }

    @Test
    void crossDayBaselineIsPreferredOverTheWindow() {
        TimeOfDayBaseline baseline = new TimeOfDayBaseline(ZoneOffset.UTC, 1, 7);
        baseline.observeAll(diurnalHistory());
        // the window only holds the last afternoon, too little for the 03:00 bucket on its own
        List<Sample> window = List.of(new Sample(at(5, 15), 100));
        DetectionRequest request = new DetectionRequest("k", new Sample(at(6, 3), 100), window, 1e9, baseline.statisticsAt(at(6, 3)));

        DetectorVerdict v = detector.evaluate(request, config);
        assertTrue(v.anomalous());
        assertEquals(Set.of(AnomalyType.TIME_PATTERN), v.types());
        assertTrue(v.detail().contains("n=5"), v.detail());
    }

    @Test
    void thinBaselineFallsBackToTheWindow() {
        TimeOfDayBaseline baseline = new TimeOfDayBaseline(ZoneOffset.UTC, 1, 7);
        baseline.observe(new Sample(at(5, 3), 2));
        DetectionRequest request = new DetectionRequest("k", new Sample(at(6, 15), 100), diurnalHistory(), 1e9, baseline.statisticsAt(at(6, 15)));
        assertFalse(detector.evaluate(request, config).anomalous());
    }
}
