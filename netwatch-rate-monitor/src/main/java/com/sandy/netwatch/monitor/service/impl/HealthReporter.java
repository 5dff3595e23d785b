package com.sandy.netwatch.monitor.service.impl;

import com.sandy.netwatch.monitor.model.AlertCategory;
import com.sandy.netwatch.monitor.model.AlertRecord;
import com.sandy.netwatch.monitor.model.KeyStatus;
import com.sandy.netwatch.monitor.model.Severity;
import com.sandy.netwatch.monitor.service.AlertSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reports problems with the monitor itself, kept apart from traffic alerts. A storage failure is reported
 * once per failing episode of a key and operation; the episode ends on the next success.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HealthReporter {

    private final AlertSink alertSink;
    private final Clock clock;
    private final Set<String> failingOperations = ConcurrentHashMap.newKeySet();

    public void storageFailure(String key, String operation, Exception e) {
        String cause = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
        if (!failingOperations.add(key + "|" + operation)) {
            log.debug("Storage still failing key={} op={} cause={}", key, operation, cause);
            return;
        }
        log.error("Storage failure key={} op={}: {}", key, operation, e.getMessage(), e);
        alertSink.publish(AlertRecord.builder()
                .category(AlertCategory.STORAGE_HEALTH)
                .severity(Severity.HIGH)
                .key(key)
                .message("Storage " + operation + " failed for " + key)
                .timestamp(clock.instant().getEpochSecond())
                .detail("operation", operation)
                .detail("cause", String.valueOf(cause))
                .build());
    }

    public void storageRecovered(String key, String operation) {
        if (failingOperations.remove(key + "|" + operation)) {
            log.info("Storage recovered key={} op={}", key, operation);
        }
    }

    public void staleKey(KeyStatus status, long nowEpoch) {
        long since = status.lastTickEpoch();
        log.warn("Key stale: key={} lastTick={} intervalSeconds={} skippedTicks={}", status.key(), since, status.intervalSeconds(), status.skippedTicks());
        alertSink.publish(AlertRecord.builder()
                .category(AlertCategory.SYSTEM_HEALTH)
                .severity(Severity.MEDIUM)
                .key(status.key())
                .message("No successful sample for " + status.key())
                .timestamp(nowEpoch)
                .detail("lastTickEpoch", since)
                .detail("intervalSeconds", status.intervalSeconds())
                .detail("skippedTicks", status.skippedTicks())
                .build());
    }

    public void configurationError(String subject, String reason, Map<String, Object> details) {
        log.error("Invalid configuration subject={} reason={} details={}", subject, reason, details);
        alertSink.publish(AlertRecord.builder()
                .category(AlertCategory.CONFIGURATION)
                .severity(Severity.HIGH)
                .key(subject)
                .message("Rejected configuration entry " + subject + ": " + reason)
                .timestamp(clock.instant().getEpochSecond())
                .details(details)
                .build());
    }
}
