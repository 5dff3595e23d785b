package com.sandy.netwatch.monitor.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.netwatch.monitor.config.MonitorProperties;
import com.sandy.netwatch.monitor.entity.Alert;
import com.sandy.netwatch.monitor.model.AlertRecord;
import com.sandy.netwatch.monitor.repository.AlertRepository;
import com.sandy.netwatch.monitor.service.AlertSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;

/**
 * Persists alert records to the {@code alerts} table. Monitor health and configuration records with the same
 * signature are suppressed within the duplicate window, traffic records never are.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RepositoryAlertSink implements AlertSink {

    private final AlertRepository alertRepository;
    private final ObjectMapper objectMapper;
    private final MonitorProperties properties;
    private final Clock clock;

    @Override
    public void publish(AlertRecord record) {
        try {
            LocalDateTime now = LocalDateTime.now(clock);
            String signature = buildSignature(record);
            if (record.getCategory().isMonitorHealth()) {
                LocalDateTime cutoff = now.minus(properties.getAlert().getDuplicateSuppressMinutes(), ChronoUnit.MINUTES);
                if (alertRepository.findTopBySignatureAndCreatedAtAfter(signature, cutoff).isPresent()) {
                    log.debug("Duplicate alert suppressed signature={} since {}", signature, cutoff);
                    return;
                }
            }
            Alert alert = Alert.builder()
                    .category(record.getCategory())
                    .severity(record.getSeverity())
                    .monitoredKey(record.getKey())
                    .message(truncate(record.getMessage(), 500))
                    .details(truncate(toJson(record), 4000))
                    .occurredAt(LocalDateTime.ofInstant(Instant.ofEpochSecond(record.getTimestamp()), ZoneId.systemDefault()))
                    .createdAt(now)
                    .signature(truncate(signature, 300))
                    .build();
            alertRepository.save(alert);
            log.info("Created alert id={} category={} severity={} key={} message={}", alert.getId(), record.getCategory(), record.getSeverity(), record.getKey(), record.getMessage());
        } catch (Exception e) {
            log.error("Failed to persist alert category={} key={}: {}", record.getCategory(), record.getKey(), e.getMessage(), e);
        }
    }

    private String buildSignature(AlertRecord record) {
        return record.getCategory() + ":" + record.getKey() + ":" + record.getMessage();
    }

    private String toJson(AlertRecord record) {
        try {
            return objectMapper.writeValueAsString(record.getDetails());
        } catch (Exception e) {
            return String.valueOf(record.getDetails());
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.length() <= max) return s;
        return s.substring(0, max);
    }
}
