package com.sandy.netwatch.monitor.service;

import com.sandy.netwatch.monitor.model.AppendResult;
import com.sandy.netwatch.monitor.model.MonitoringKey;
import com.sandy.netwatch.monitor.model.RetentionPolicy;
import com.sandy.netwatch.monitor.model.Sample;
import com.sandy.netwatch.monitor.model.StorageStatistics;
import com.sandy.netwatch.monitor.model.SweepReport;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Per-key time series with compression and tiered retention. Implementations never throw on backing
 * store failures; they degrade to the in-memory image and report storage health instead.
 */
public interface SeriesStorageService {

    /** Declares a key and its raw capacity. Keys seen only through {@link #append} get a default capacity. */
    void register(MonitoringKey key);

    /**
     * Appends a sample. Timestamps must be strictly increasing per key; when the raw ring is full the oldest
     * sample is evicted.
     */
    AppendResult append(String key, Sample sample);

    /** Aggregates and raw samples with {@code start <= timestamp <= end}, in timestamp order. */
    List<Sample> range(String key, long start, long end);

    /** The newest {@code limit} raw samples, oldest first. */
    List<Sample> recent(String key, int limit);

    Optional<Sample> latest(String key);

    Set<String> keys();

    /**
     * Applies one retention pass to a key.
     *
     * @return empty when the key could not be read or written back
     */
    Optional<SweepReport> applyRetention(String key, RetentionPolicy policy, long nowEpoch);

    StorageStatistics statistics();
}
