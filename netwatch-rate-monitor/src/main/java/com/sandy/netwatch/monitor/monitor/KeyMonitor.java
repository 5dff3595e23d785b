package com.sandy.netwatch.monitor.monitor;

import com.sandy.netwatch.monitor.detection.DetectionRequest;
import com.sandy.netwatch.monitor.detection.TimeOfDayBaseline;
import com.sandy.netwatch.monitor.model.AlertCategory;
import com.sandy.netwatch.monitor.model.AlertRecord;
import com.sandy.netwatch.monitor.model.AnomalyEvent;
import com.sandy.netwatch.monitor.model.AppendResult;
import com.sandy.netwatch.monitor.model.KeyStatus;
import com.sandy.netwatch.monitor.model.MonitoringKey;
import com.sandy.netwatch.monitor.model.Sample;
import com.sandy.netwatch.monitor.model.ThresholdConfig;
import com.sandy.netwatch.monitor.service.AlertSink;
import com.sandy.netwatch.monitor.service.CounterSource;
import com.sandy.netwatch.monitor.service.CounterUnavailableException;
import com.sandy.netwatch.monitor.service.DetectionStrategy;
import com.sandy.netwatch.monitor.service.SeriesStorageService;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recurring task of one monitored key. It owns the key's threshold tracker, anomaly history and time-of-day
 * baseline; nothing else mutates them.
 */
@Slf4j
public class KeyMonitor {

    private final MonitoringKey key;
    private final ThresholdConfig config;
    private final CounterSource counterSource;
    private final SeriesStorageService storage;
    private final DetectionStrategy strategy;
    private final AlertSink alertSink;
    private final Clock clock;
    private final int windowSize;

    private final ThresholdTracker tracker;
    private final AnomalyHistory anomalyHistory;
    private final TimeOfDayBaseline baseline;
    private final long createdEpoch;

    /** Set on the first tick from what the store already holds. */
    private boolean primed;
    private long lastSampleTimestamp = Long.MIN_VALUE;

    private volatile long lastTickEpoch;
    private volatile Double lastValue;
    private volatile int skippedTicks;

    public KeyMonitor(ThresholdConfig config, CounterSource counterSource, SeriesStorageService storage,
                      DetectionStrategy strategy, AlertSink alertSink, Clock clock, TimeOfDayBaseline baseline,
                      int windowSize, int historySize) {
        this.key = MonitoringKey.of(config);
        this.config = config;
        this.counterSource = counterSource;
        this.storage = storage;
        this.strategy = strategy;
        this.alertSink = alertSink;
        this.clock = clock;
        this.windowSize = windowSize;
        this.tracker = new ThresholdTracker(config);
        this.anomalyHistory = new AnomalyHistory(historySize);
        this.baseline = baseline;
        this.createdEpoch = clock.instant().getEpochSecond();
        storage.register(key);
        counterSource.register(key.id());
    }

    /**
     * One sampling step. Never throws, so a failing tick cannot cancel the key's schedule.
     */
    public void tick() {
        try {
            doTick();
        } catch (RuntimeException e) {
            log.error("Tick failed key={}: {}", key.id(), e.getMessage(), e);
        }
    }

    private void doTick() {
        long now = clock.instant().getEpochSecond();
        long interval = Math.max(1, config.intervalSeconds());
        long timestamp = now - Math.floorMod(now, interval);
        if (!primed) {
            prime(timestamp);
        }
        // checked before the read so the counter keeps accumulating into the next tick
        if (timestamp <= lastSampleTimestamp) {
            log.debug("Duplicate tick ignored key={} ts={} latestTs={}", key.id(), timestamp, lastSampleTimestamp);
            return;
        }

        double value;
        try {
            value = counterSource.read(key.id());
        } catch (CounterUnavailableException e) {
            skippedTicks++;
            log.warn("Counter unavailable, tick skipped key={} ts={} reason={}", key.id(), timestamp, e.getMessage());
            return;
        }

        Sample sample = new Sample(timestamp, value);
        AppendResult result = storage.append(key.id(), sample);
        if (result == AppendResult.REJECTED) {
            log.debug("Sample rejected by storage key={} ts={}", key.id(), timestamp);
            storage.latest(key.id()).ifPresent(s -> lastSampleTimestamp = Math.max(lastSampleTimestamp, s.timestamp()));
            return;
        }
        lastSampleTimestamp = timestamp;

        List<Sample> history = new ArrayList<>(windowSize);
        for (Sample s : storage.recent(key.id(), windowSize + 1)) {
            if (s.timestamp() < timestamp) history.add(s);
        }
        if (history.size() > windowSize) {
            history = history.subList(history.size() - windowSize, history.size());
        }

        DetectionRequest request = new DetectionRequest(key.id(), sample, history, config.maxValue(),
                baseline.statisticsAt(timestamp));
        Optional<AnomalyEvent> event = strategy.evaluate(request, anomalyHistory);
        event.ifPresent(e -> alertSink.publish(toRecord(e)));
        baseline.observe(sample);

        ThresholdTracker.Outcome outcome = tracker.observe(sample);
        outcome.records().forEach(alertSink::publish);
        if (outcome.clearedAlarm() != null) {
            storage.append(key.alarmHistoryKey(), outcome.clearedAlarm());
        }

        lastValue = value;
        lastTickEpoch = now;
        log.debug("Tick key={} ts={} value={} result={} violations={}", key.id(), timestamp, value, result, tracker.getConsecutiveViolations());
    }

    /**
     * Loads the latest stored timestamp and seeds the baseline with the stored range it covers, aggregates
     * included. A store that cannot be read simply leaves both empty.
     */
    private void prime(long timestamp) {
        primed = true;
        storage.latest(key.id()).ifPresent(s -> lastSampleTimestamp = s.timestamp());
        List<Sample> stored = storage.range(key.id(), timestamp - baseline.spanSeconds(), timestamp - 1);
        baseline.observeAll(stored);
        log.debug("Primed key={} latestTs={} baselineSamples={}", key.id(), lastSampleTimestamp, stored.size());
    }

    private AlertRecord toRecord(AnomalyEvent event) {
        return AlertRecord.builder()
                .category(AlertCategory.ANOMALY)
                .severity(event.getSeverity())
                .key(event.getKey())
                .message(String.format("Anomaly on %s: value %.2f types=%s confidence=%.2f",
                        event.getKey(), event.getValue(), event.getTriggeredTypes(), event.getConfidence()))
                .timestamp(event.getTimestamp())
                .detail("value", event.getValue())
                .detail("types", event.getTriggeredTypes())
                .detail("confidence", event.getConfidence())
                .detail("detectorScores", event.getDetectorScores())
                .build();
    }

    /**
     * Read-only snapshot for the scan loop.
     *
     * @param staleFactor a key is stale when its last successful tick is older than this many intervals
     */
    public KeyStatus status(long nowEpoch, int staleFactor) {
        long reference = lastTickEpoch > 0 ? lastTickEpoch : createdEpoch;
        boolean stale = nowEpoch - reference > (long) staleFactor * Math.max(1, config.intervalSeconds());
        return new KeyStatus(key.id(), config.intervalSeconds(), config.maxValue(), lastValue,
                tracker.getConsecutiveViolations(), config.consecutiveDuration(),
                tracker.isAlarmActive(), tracker.getAlarmSince(), lastTickEpoch, skippedTicks, stale);
    }

    public MonitoringKey getKey() {
        return key;
    }

    public ThresholdConfig getConfig() {
        return config;
    }

    public AnomalyHistory getAnomalyHistory() {
        return anomalyHistory;
    }

    public String getStrategyName() {
        return strategy.name();
    }
}
