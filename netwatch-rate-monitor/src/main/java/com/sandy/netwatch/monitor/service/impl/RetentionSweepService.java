package com.sandy.netwatch.monitor.service.impl;

import com.sandy.netwatch.monitor.model.RetentionPolicy;
import com.sandy.netwatch.monitor.model.SweepReport;
import com.sandy.netwatch.monitor.service.SeriesStorageService;
import com.sandy.netwatch.monitor.storage.RetentionPolicyResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Background retention pass over every stored key.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RetentionSweepService {

    private final SeriesStorageService storage;
    private final RetentionPolicyResolver policyResolver;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${monitor.storage.retention.sweep-interval-ms:300000}",
            initialDelayString = "${monitor.storage.retention.sweep-interval-ms:300000}")
    public void scheduledSweep() {
        try { sweepOnce(); } catch (Exception e) { log.error("Scheduled retention sweep failed: {}", e.getMessage(), e); }
    }

    public List<SweepReport> sweepOnce() {
        long now = clock.instant().getEpochSecond();
        List<SweepReport> reports = new ArrayList<>();
        int changed = 0;
        for (String key : storage.keys()) {
            Optional<RetentionPolicy> policy = policyResolver.resolve(key);
            if (policy.isEmpty()) {
                log.debug("No retention policy for key={}", key);
                continue;
            }
            Optional<SweepReport> report = storage.applyRetention(key, policy.get(), now);
            if (report.isEmpty()) continue;
            reports.add(report.get());
            if (report.get().changed()) changed++;
        }
        if (changed > 0) {
            log.info("Retention sweep completed. keys={} changed={} bucketsCreated={} aggregatesDropped={}", reports.size(), changed,
                    reports.stream().mapToInt(SweepReport::bucketsCreated).sum(),
                    reports.stream().mapToInt(SweepReport::aggregatesDropped).sum());
        } else {
            log.debug("Retention sweep completed, nothing to do. keys={}", reports.size());
        }
        return reports;
    }
}
