package com.sandy.netwatch.monitor.detection;

import com.sandy.netwatch.monitor.model.AnomalyType;
import com.sandy.netwatch.monitor.model.DetectorConfig;
import com.sandy.netwatch.monitor.model.DetectorVerdict;
import com.sandy.netwatch.monitor.model.Sample;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TrendDetectorTest {

    private final TrendDetector detector = new TrendDetector();
    private final DetectorConfig config = DetectorConfig.builder().trendWindow(10).trendThreshold(0.2).build();

    private DetectorVerdict eval(double... values) {
        List<Sample> history = new ArrayList<>();
        for (int i = 0; i < values.length - 1; i++) history.add(new Sample(i, values[i]));
        Sample last = new Sample(values.length - 1, values[values.length - 1]);
        return detector.evaluate(new DetectionRequest("k", last, history, 1e9), config);
    }

    @Test
    void strictlyIncreasingSequenceIsIncreasingTrend() {
        DetectorVerdict v = eval(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
        assertTrue(v.anomalous());
        assertEquals(Set.of(AnomalyType.INCREASING_TREND), v.types());
        assertEquals(1.0, v.score(), 1e-9);
    }

    @Test
    void decreasingSequenceIsDecreasingTrend() {
        DetectorVerdict v = eval(50, 45, 41, 36, 30, 26, 20, 15, 11, 5);
        assertEquals(Set.of(AnomalyType.DECREASING_TREND), v.types());
    }

    @Test
    void flatSequenceHasNoTrend() {
        DetectorVerdict v = eval(7, 7, 7, 7, 7, 7, 7, 7, 7, 7);
        assertFalse(v.anomalous());
        assertEquals(0.0, TrendDetector.normalizedTrend(List.of(7.0, 7.0, 7.0)));
    }

    @Test
    void noiseAroundALevelStaysBelowThreshold() {
        assertFalse(eval(10, 12, 9, 11, 10, 12, 9, 11, 10, 10).anomalous());
    }

    @Test
    void onlyTheNewestWindowCounts() {
        // a long rise followed by a flat window of ten points
        assertFalse(eval(1, 2, 3, 4, 5, 6, 7, 8, 9, 9, 9, 9, 9, 9, 9, 9, 9, 9, 9).anomalous());
    }

    @Test
    void abstainsBelowWindowSize() {
        DetectorVerdict v = eval(1, 2, 3, 4, 5);
        assertFalse(v.anomalous());
        assertTrue(v.detail().startsWith("need 10"));
    }

    @Test
    void trendIsClampedToUnitRange() {
        double t = TrendDetector.normalizedTrend(List.of(0.0, 0.0, 0.0, 0.0, 100.0));
        assertTrue(t <= 1.0 && t > 0);
    }
}
