package com.sandy.netwatch.monitor.monitor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.netwatch.monitor.InMemoryBlockStoreTest;
import com.sandy.netwatch.monitor.MutableClock;
import com.sandy.netwatch.monitor.RecordingAlertSink;
import com.sandy.netwatch.monitor.ScriptedCounterSource;
import com.sandy.netwatch.monitor.detection.DetectionManager;
import com.sandy.netwatch.monitor.detection.TimeOfDayBaseline;
import com.sandy.netwatch.monitor.model.AlertCategory;
import com.sandy.netwatch.monitor.model.AlertRecord;
import com.sandy.netwatch.monitor.model.AnomalyEvent;
import com.sandy.netwatch.monitor.model.AnomalyType;
import com.sandy.netwatch.monitor.model.DetectorConfig;
import com.sandy.netwatch.monitor.model.KeyStatus;
import com.sandy.netwatch.monitor.model.Sample;
import com.sandy.netwatch.monitor.model.ThresholdConfig;
import com.sandy.netwatch.monitor.service.CounterSource;
import com.sandy.netwatch.monitor.service.DetectionStrategy;
import com.sandy.netwatch.monitor.service.impl.CompressedSeriesStorageService;
import com.sandy.netwatch.monitor.service.impl.EnhancedDetectionStrategy;
import com.sandy.netwatch.monitor.service.impl.HealthReporter;
import com.sandy.netwatch.monitor.service.impl.IntervalCounterRegistry;
import com.sandy.netwatch.monitor.service.impl.LegacyDetectionStrategy;
import com.sandy.netwatch.monitor.storage.BlockCodec;
import com.sandy.netwatch.monitor.storage.StorageOperations;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class KeyMonitorTest {

    private static final long T0 = 1_700_000_000L;
    private static final ThresholdConfig TOTAL = new ThresholdConfig("total:s", 1, 20, 3, 500);

    /** One monitor with its own store, clock and sink. */
    private static class Rig {
        final InMemoryBlockStoreTest store = new InMemoryBlockStoreTest();
        final RecordingAlertSink sink = new RecordingAlertSink();
        final MutableClock clock = new MutableClock(Instant.ofEpochSecond(T0));
        final ScriptedCounterSource counter = new ScriptedCounterSource();
        final CompressedSeriesStorageService storage;
        final KeyMonitor monitor;

        Rig(ThresholdConfig config, DetectionStrategy strategy) {
            this(config, strategy, null);
        }

        Rig(ThresholdConfig config, DetectionStrategy strategy, CounterSource source) {
            StorageOperations ops = new StorageOperations(store, new SimpleAsyncTaskExecutor("key-monitor-test-"), 500, 2, 1, 2.0);
            storage = new CompressedSeriesStorageService(ops, new BlockCodec(new ObjectMapper(), true, 6, 100),
                    new HealthReporter(sink, clock));
            monitor = new KeyMonitor(config, source == null ? counter : source, storage, strategy, sink, clock,
                    new TimeOfDayBaseline(ZoneOffset.UTC, 1, 7), 60, 50);
        }

        void tick() {
            clock.advance(Duration.ofSeconds(monitor.getConfig().intervalSeconds()));
            monitor.tick();
        }

        void ticks(int n) {
            for (int i = 0; i < n; i++) tick();
        }
    }

    private static DetectionStrategy enhanced() {
        return new EnhancedDetectionStrategy(DetectionManager.withDefaultDetectors(
                DetectorConfig.builder().zone(ZoneOffset.UTC).build()));
    }

    private static List<String> thresholdRecords(RecordingAlertSink sink) {
        return sink.all().stream()
                .filter(r -> r.getCategory() == AlertCategory.THRESHOLD_VIOLATION || r.getCategory() == AlertCategory.THRESHOLD_CLEARED)
                .map(r -> r.getCategory() + "|" + r.getSeverity() + "|" + r.getTimestamp() + "|" + r.getMessage())
                .collect(Collectors.toList());
    }

    @Test
    void legacyAndEnhancedAgreeOnThresholdRecords() {
        Rig legacy = new Rig(TOTAL, new LegacyDetectionStrategy());
        Rig enhanced = new Rig(TOTAL, enhanced());
        for (Rig rig : List.of(legacy, enhanced)) {
            rig.counter.repeat(5, 12).repeat(25, 4).repeat(5, 5);
            rig.ticks(21);
        }

        List<String> expected = thresholdRecords(legacy.sink);
        assertEquals(2, expected.size());
        assertTrue(expected.get(0).startsWith("THRESHOLD_VIOLATION|HIGH|" + (T0 + 15)));
        assertTrue(expected.get(1).startsWith("THRESHOLD_CLEARED|LOW|" + (T0 + 19)));
        assertEquals(expected, thresholdRecords(enhanced.sink));

        assertTrue(legacy.sink.of(AlertCategory.ANOMALY).isEmpty());
        assertFalse(enhanced.sink.of(AlertCategory.ANOMALY).isEmpty());
        assertEquals(enhanced.sink.of(AlertCategory.ANOMALY).size(), enhanced.monitor.getAnomalyHistory().total());
        assertEquals("legacy", legacy.monitor.getStrategyName());
        assertEquals("enhanced", enhanced.monitor.getStrategyName());
    }

    @Test
    void samplesAreStoredAndClearedAlarmIsArchived() {
        Rig rig = new Rig(TOTAL, new LegacyDetectionStrategy());
        rig.counter.repeat(25, 3).repeat(5, 3);
        rig.ticks(6);

        List<Sample> stored = rig.storage.range("total:s", T0, T0 + 10);
        assertEquals(6, stored.size());
        assertEquals(new Sample(T0 + 1, 25), stored.get(0));

        List<Sample> alarms = rig.storage.range("total:s:alarm-history", 0, Long.MAX_VALUE);
        assertEquals(List.of(new Sample(T0 + 3, T0 + 6)), alarms);
    }

    @Test
    void unavailableCounterSkipsTickWithoutResettingViolations() {
        Rig rig = new Rig(TOTAL, new LegacyDetectionStrategy());
        rig.counter.then(25, 25).unavailable().then(25);
        rig.ticks(3);

        KeyStatus status = rig.monitor.status(rig.clock.instant().getEpochSecond(), 3);
        assertEquals(2, status.consecutiveViolations());
        assertEquals(1, status.skippedTicks());
        assertTrue(rig.sink.all().isEmpty());
        assertEquals(2, rig.storage.recent("total:s", 10).size());

        rig.tick();
        assertEquals(1, rig.sink.of(AlertCategory.THRESHOLD_VIOLATION).size());
    }

    @Test
    void storeOutageDoesNotStopDetection() {
        Rig rig = new Rig(TOTAL, new LegacyDetectionStrategy());
        rig.store.setFailing(true);
        rig.counter.repeat(25, 5);
        rig.ticks(5);

        assertEquals(1, rig.sink.of(AlertCategory.THRESHOLD_VIOLATION).size());
        List<AlertRecord> health = rig.sink.of(AlertCategory.STORAGE_HEALTH);
        assertEquals(1, health.size());
        assertEquals("total:s", health.get(0).getKey());
        assertEquals(5, rig.storage.recent("total:s", 10).size());
    }

    @Test
    void duplicateTimestampIsIgnored() {
        Rig rig = new Rig(new ThresholdConfig("total:s", 1, 20, 2, 500), new LegacyDetectionStrategy());
        rig.counter.repeat(25, 3);
        rig.tick();
        rig.monitor.tick();
        assertEquals(1, rig.monitor.status(T0 + 1, 3).consecutiveViolations());
        assertEquals(2, rig.counter.remaining(), "duplicate tick must not consume a reading");
        rig.tick();
        assertEquals(1, rig.sink.of(AlertCategory.THRESHOLD_VIOLATION).size());
    }

    @Test
    void countsSeenDuringDuplicateTickGoToTheNextSample() {
        IntervalCounterRegistry registry = new IntervalCounterRegistry();
        Rig rig = new Rig(new ThresholdConfig("total:m", 60, 1000, 3, 100), new LegacyDetectionStrategy(), registry);
        registry.count("total", 4);
        rig.tick();
        registry.count("total", 5);
        rig.monitor.tick();
        registry.count("total", 2);
        rig.tick();

        List<Sample> stored = rig.storage.range("total:m", 0, Long.MAX_VALUE);
        assertEquals(2, stored.size());
        assertEquals(4.0, stored.get(0).value());
        assertEquals(7.0, stored.get(1).value());
    }

    @Test
    void restartedMonitorSkipsTimestampsAlreadyStored() {
        Rig rig = new Rig(new ThresholdConfig("total:m", 60, 1000, 3, 100), new LegacyDetectionStrategy());
        long aligned = T0 - Math.floorMod(T0, 60) + 120;
        rig.storage.append("total:m", new Sample(aligned, 9));
        rig.counter.then(3, 4);
        rig.clock.set(Instant.ofEpochSecond(aligned + 5));
        rig.monitor.tick();
        assertEquals(2, rig.counter.remaining());

        rig.tick();
        assertEquals(new Sample(aligned + 60, 3), rig.storage.latest("total:m").orElseThrow());
    }

    @Test
    void timestampIsAlignedToInterval() {
        Rig rig = new Rig(new ThresholdConfig("errors:m", 60, 5, 2, 100), new LegacyDetectionStrategy());
        rig.counter.then(3);
        rig.clock.set(Instant.ofEpochSecond(T0 + 17));
        rig.monitor.tick();
        long expected = T0 + 17 - Math.floorMod(T0 + 17, 60);
        assertEquals(expected, rig.storage.latest("errors:m").orElseThrow().timestamp());
    }

    @Test
    void keyWithoutTicksBecomesStale() {
        Rig rig = new Rig(TOTAL, new LegacyDetectionStrategy());
        assertFalse(rig.monitor.status(T0 + 2, 3).stale());
        assertTrue(rig.monitor.status(T0 + 10, 3).stale());

        rig.counter.then(1);
        rig.clock.set(Instant.ofEpochSecond(T0 + 10));
        rig.monitor.tick();
        KeyStatus status = rig.monitor.status(T0 + 11, 3);
        assertFalse(status.stale());
        assertEquals(1.0, status.lastValue());
        assertEquals(T0 + 10, status.lastTickEpoch());
    }

    @Test
    void nightDropIsRememberedAcrossDays() {
        long midnight = 1_700_006_400L; // 2023-11-15T00:00:00Z
        long dayTwoThree = midnight + 86400 + 3 * 3600;
        Rig rig = new Rig(new ThresholdConfig("rate:m", 60, 10_000, 3, 200), enhanced());
        for (long t = midnight; t <= dayTwoThree; t += 60) {
            int minute = (int) ((t - midnight) / 60);
            boolean quietHour = t < midnight + 86400 && (minute / 60) % 24 == 3;
            rig.counter.then(quietHour ? 5 + minute % 3 : 100 + minute % 5);
        }
        rig.clock.set(Instant.ofEpochSecond(midnight - 60));

        rig.ticks((int) ((dayTwoThree - midnight) / 60));
        assertFalse(rig.monitor.getAnomalyHistory().typeDistribution().containsKey(AnomalyType.TIME_PATTERN));

        rig.tick();
        assertEquals(0, rig.counter.remaining());
        AnomalyEvent last = rig.monitor.getAnomalyHistory().recent(1).get(0);
        assertEquals(dayTwoThree, last.getTimestamp());
        assertTrue(last.getTriggeredTypes().contains(AnomalyType.TIME_PATTERN), last.getTriggeredTypes().toString());
        assertEquals(1L, rig.monitor.getAnomalyHistory().typeDistribution().get(AnomalyType.TIME_PATTERN));
    }
}
