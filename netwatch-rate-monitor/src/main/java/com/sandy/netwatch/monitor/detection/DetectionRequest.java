package com.sandy.netwatch.monitor.detection;

import com.sandy.netwatch.monitor.model.Sample;

import java.util.List;

/**
 * Input to every detector.
 *
 * @param history        samples strictly before {@code sample}, oldest first
 * @param maxValue       configured threshold of the key
 * @param bucketBaseline earlier observations in the time-of-day bucket of {@code sample}, spanning previous
 *                       days; {@code null} when the caller keeps no such baseline
 */
public record DetectionRequest(String key, Sample sample, List<Sample> history, double maxValue,
                               WindowStatistics bucketBaseline) {

    public DetectionRequest {
        history = List.copyOf(history);
        for (Sample s : history) {
            if (s.timestamp() >= sample.timestamp()) {
                throw new IllegalArgumentException("History for " + key + " contains sample at " + s.timestamp()
                        + " not before " + sample.timestamp());
            }
        }
    }

    public DetectionRequest(String key, Sample sample, List<Sample> history, double maxValue) {
        this(key, sample, history, maxValue, null);
    }
}
