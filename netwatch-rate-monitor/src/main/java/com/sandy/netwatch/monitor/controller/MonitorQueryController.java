package com.sandy.netwatch.monitor.controller;

import com.sandy.netwatch.monitor.entity.Alert;
import com.sandy.netwatch.monitor.model.KeyStatus;
import com.sandy.netwatch.monitor.model.StorageStatistics;
import com.sandy.netwatch.monitor.service.MonitorQueryService;
import com.sandy.netwatch.monitor.vo.AnomalyHistoryRsp;
import com.sandy.netwatch.monitor.vo.SeriesRsp;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;

/**
 * Read-only JSON endpoints over series, anomaly history, key status and storage statistics.
 */
@RestController
@RequestMapping("/api/monitor")
@RequiredArgsConstructor
@Slf4j
public class MonitorQueryController {

    private static final long DEFAULT_RANGE_SECONDS = 3600;

    private final MonitorQueryService monitorQueryService;
    private final Clock clock;

    @GetMapping("/keys")
    public List<KeyStatus> keys() {
        return monitorQueryService.keyStatuses();
    }

    @GetMapping("/series")
    public ResponseEntity<SeriesRsp> series(@RequestParam String key,
                                            @RequestParam(required = false) Long start,
                                            @RequestParam(required = false) Long end) {
        long e = end != null ? end : clock.instant().getEpochSecond();
        long s = start != null ? start : e - DEFAULT_RANGE_SECONDS;
        if (s > e) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(SeriesRsp.of(key, s, e, monitorQueryService.series(key, s, e)));
    }

    @GetMapping("/anomalies")
    public ResponseEntity<AnomalyHistoryRsp> anomalies(@RequestParam String key,
                                                       @RequestParam(defaultValue = "100") int limit) {
        boolean known = monitorQueryService.keyStatuses().stream().anyMatch(k -> k.key().equals(key));
        if (!known) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(AnomalyHistoryRsp.builder()
                .key(key)
                .events(monitorQueryService.anomalies(key, limit))
                .distribution(monitorQueryService.anomalyDistribution(key))
                .build());
    }

    @GetMapping("/alerts/recent")
    public List<Alert> recentAlerts() {
        return monitorQueryService.recentAlerts();
    }

    @GetMapping("/storage/stats")
    public StorageStatistics storageStats() {
        return monitorQueryService.storageStatistics();
    }
}
