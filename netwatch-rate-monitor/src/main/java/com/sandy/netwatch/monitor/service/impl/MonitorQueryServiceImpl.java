package com.sandy.netwatch.monitor.service.impl;

import com.sandy.netwatch.monitor.config.MonitorProperties;
import com.sandy.netwatch.monitor.entity.Alert;
import com.sandy.netwatch.monitor.model.AnomalyEvent;
import com.sandy.netwatch.monitor.model.AnomalyType;
import com.sandy.netwatch.monitor.model.KeyStatus;
import com.sandy.netwatch.monitor.model.Sample;
import com.sandy.netwatch.monitor.model.StorageStatistics;
import com.sandy.netwatch.monitor.monitor.KeyMonitor;
import com.sandy.netwatch.monitor.repository.AlertRepository;
import com.sandy.netwatch.monitor.service.MonitorQueryService;
import com.sandy.netwatch.monitor.service.SeriesStorageService;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class MonitorQueryServiceImpl implements MonitorQueryService {

    private final RateMonitorScheduler rateMonitorScheduler;
    private final SeriesStorageService storage;
    private final AlertRepository alertRepository;
    private final MonitorProperties properties;
    private final Clock clock;

    @Override
    public List<KeyStatus> keyStatuses() {
        long now = clock.instant().getEpochSecond();
        return rateMonitorScheduler.monitors().stream()
                .map(m -> m.status(now, properties.getStaleFactor()))
                .toList();
    }

    @Override
    public List<Sample> series(String key, long start, long end) {
        return storage.range(key, start, end);
    }

    @Override
    public List<AnomalyEvent> anomalies(String key, int limit) {
        return rateMonitorScheduler.monitor(key)
                .map(m -> m.getAnomalyHistory().recent(limit))
                .orElse(Collections.emptyList());
    }

    @Override
    public Map<AnomalyType, Long> anomalyDistribution(String key) {
        return rateMonitorScheduler.monitor(key)
                .map(KeyMonitor::getAnomalyHistory)
                .map(h -> h.typeDistribution())
                .orElse(Collections.emptyMap());
    }

    @Override
    public List<Alert> recentAlerts() {
        return alertRepository.findByOrderByCreatedAtDescIdDesc(PageRequest.of(0, properties.getAlert().getRecentLimit()));
    }

    @Override
    public StorageStatistics storageStatistics() {
        return storage.statistics();
    }
}
