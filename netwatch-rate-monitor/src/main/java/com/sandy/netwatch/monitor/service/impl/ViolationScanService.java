package com.sandy.netwatch.monitor.service.impl;

import com.sandy.netwatch.monitor.config.MonitorProperties;
import com.sandy.netwatch.monitor.model.KeyStatus;
import com.sandy.netwatch.monitor.monitor.KeyMonitor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Global scan, independent of the per-key cadence: snapshots every key's violation state and reports keys that
 * stopped producing samples. Never modifies per-key state.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ViolationScanService {

    private final RateMonitorScheduler rateMonitorScheduler;
    private final HealthReporter healthReporter;
    private final MonitorProperties properties;
    private final Clock clock;

    private final Set<String> staleKeys = ConcurrentHashMap.newKeySet();
    private volatile List<KeyStatus> lastSnapshot = Collections.emptyList();

    @Scheduled(fixedDelayString = "${monitor.scan-interval-ms:10000}", initialDelayString = "${monitor.scan-interval-ms:10000}")
    public void scheduledScan() {
        try { scanOnce(); } catch (Exception e) { log.error("Scheduled violation scan failed: {}", e.getMessage(), e); }
    }

    /**
     * Public entry point for tests / manual trigger.
     */
    public List<KeyStatus> scanOnce() {
        long now = clock.instant().getEpochSecond();
        List<KeyStatus> statuses = new ArrayList<>();
        int violating = 0;
        int inAlarm = 0;
        for (KeyMonitor monitor : rateMonitorScheduler.monitors()) {
            KeyStatus status = monitor.status(now, properties.getStaleFactor());
            statuses.add(status);
            if (status.consecutiveViolations() > 0) violating++;
            if (status.alarmActive()) inAlarm++;
            if (status.stale()) {
                if (staleKeys.add(status.key())) {
                    healthReporter.staleKey(status, now);
                }
            } else if (staleKeys.remove(status.key())) {
                log.info("Key producing samples again key={}", status.key());
            }
        }
        lastSnapshot = Collections.unmodifiableList(statuses);
        log.debug("Violation scan completed. keys={} violating={} inAlarm={} stale={}", statuses.size(), violating, inAlarm, staleKeys.size());
        return lastSnapshot;
    }

    public List<KeyStatus> getLastSnapshot() {
        return lastSnapshot;
    }
}
