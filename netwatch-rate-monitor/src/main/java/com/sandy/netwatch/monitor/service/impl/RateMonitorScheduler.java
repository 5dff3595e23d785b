package com.sandy.netwatch.monitor.service.impl;

import com.sandy.netwatch.monitor.config.MonitorProperties;
import com.sandy.netwatch.monitor.detection.TimeOfDayBaseline;
import com.sandy.netwatch.monitor.model.DetectorConfig;
import com.sandy.netwatch.monitor.model.ThresholdConfig;
import com.sandy.netwatch.monitor.monitor.KeyMonitor;
import com.sandy.netwatch.monitor.service.AlertSink;
import com.sandy.netwatch.monitor.service.CounterSource;
import com.sandy.netwatch.monitor.service.DetectionStrategy;
import com.sandy.netwatch.monitor.service.SeriesStorageService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns one {@link KeyMonitor} per valid metric and runs each at its own fixed rate.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RateMonitorScheduler {

    private final MonitorProperties properties;
    private final ThresholdConfigValidator validator;
    private final CounterSource counterSource;
    private final SeriesStorageService storage;
    private final DetectionStrategy detectionStrategy;
    private final DetectorConfig detectorConfig;
    private final AlertSink alertSink;
    private final ThreadPoolTaskScheduler monitorTaskScheduler;
    private final Clock clock;

    @Value("${monitor.scheduler.enabled:true}")
    private boolean schedulingEnabled;

    private final Map<String, KeyMonitor> monitors = new LinkedHashMap<>();
    private final List<ScheduledFuture<?>> futures = new ArrayList<>();

    @PostConstruct
    public void init() {
        MonitorProperties.Detection detection = properties.getDetection();
        for (ThresholdConfig config : validator.validateMetrics(properties.getMetrics())) {
            TimeOfDayBaseline baseline = new TimeOfDayBaseline(detectorConfig.getZone(),
                    detectorConfig.getHourGranularity(), detection.getBaselineDays());
            monitors.put(config.monitoredKey(), new KeyMonitor(config, counterSource, storage, detectionStrategy,
                    alertSink, clock, baseline, detection.getWindowSize(), detection.getHistorySize()));
            log.info("Monitoring key={} intervalSeconds={} maxValue={} consecutiveDuration={} maxSamples={}",
                    config.monitoredKey(), config.intervalSeconds(), config.maxValue(), config.consecutiveDuration(), config.maxSamples());
        }
        log.info("Rate monitor initialized: keys={} strategy={} schedulingEnabled={}", monitors.size(), detectionStrategy.name(), schedulingEnabled);
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (!schedulingEnabled || !futures.isEmpty()) return;
        for (KeyMonitor monitor : monitors.values()) {
            Duration period = Duration.ofSeconds(Math.max(1, monitor.getConfig().intervalSeconds()));
            futures.add(monitorTaskScheduler.scheduleAtFixedRate(monitor::tick, period));
        }
        log.info("Scheduled {} key monitors", futures.size());
    }

    @PreDestroy
    public synchronized void stop() {
        futures.forEach(f -> f.cancel(false));
        futures.clear();
    }

    public Collection<KeyMonitor> monitors() {
        return Collections.unmodifiableCollection(monitors.values());
    }

    public Optional<KeyMonitor> monitor(String key) {
        return Optional.ofNullable(monitors.get(key));
    }
}
