package com.sandy.netwatch.monitor.service;

import com.sandy.netwatch.monitor.entity.Alert;
import com.sandy.netwatch.monitor.model.AnomalyEvent;
import com.sandy.netwatch.monitor.model.AnomalyType;
import com.sandy.netwatch.monitor.model.KeyStatus;
import com.sandy.netwatch.monitor.model.Sample;
import com.sandy.netwatch.monitor.model.StorageStatistics;

import java.util.List;
import java.util.Map;

/**
 * Read-only view for reporting collaborators.
 */
public interface MonitorQueryService {

    List<KeyStatus> keyStatuses();

    List<Sample> series(String key, long start, long end);

    List<AnomalyEvent> anomalies(String key, int limit);

    Map<AnomalyType, Long> anomalyDistribution(String key);

    List<Alert> recentAlerts();

    StorageStatistics storageStatistics();
}
