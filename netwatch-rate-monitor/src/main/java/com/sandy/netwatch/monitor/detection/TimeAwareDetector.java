package com.sandy.netwatch.monitor.detection;

import com.sandy.netwatch.monitor.model.AnomalyType;
import com.sandy.netwatch.monitor.model.DetectorConfig;
import com.sandy.netwatch.monitor.model.DetectorKind;
import com.sandy.netwatch.monitor.model.DetectorVerdict;
import com.sandy.netwatch.monitor.model.Sample;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * z-score against earlier samples in the same time-of-day bucket as the new sample, so a level that is normal
 * in the afternoon can still be flagged at night.
 * <p>
 * The request's cross-day bucket baseline is used once it holds {@code minBucketHistory} points; until then
 * the window samples of the same bucket stand in for it.
 */
@Component
public class TimeAwareDetector implements AnomalyDetector {

    @Override
    public DetectorKind kind() {
        return DetectorKind.TIME_AWARE;
    }

    @Override
    public DetectorVerdict evaluate(DetectionRequest request, DetectorConfig config) {
        int bucket = bucketOf(request.sample().timestamp(), config.getZone(), config.getHourGranularity());
        WindowStatistics stats = request.bucketBaseline();
        if (stats == null || stats.count() < config.getMinBucketHistory()) {
            List<Sample> inBucket = new ArrayList<>();
            for (Sample s : request.history()) {
                if (bucketOf(s.timestamp(), config.getZone(), config.getHourGranularity()) == bucket) {
                    inBucket.add(s);
                }
            }
            if (inBucket.size() < config.getMinBucketHistory()) {
                return DetectorVerdict.abstain(kind(), "bucket " + bucket + " has " + inBucket.size() + " points");
            }
            stats = WindowStatistics.of(inBucket);
        }
        double z = stats.zScore(request.sample().value(), config.getStddevFloor());
        String detail = String.format("bucket=%d z=%.2f mean=%.2f stddev=%.2f n=%d", bucket, z, stats.mean(), stats.stddev(), stats.count());
        if (Math.abs(z) <= config.getZscoreThreshold()) {
            return DetectorVerdict.normal(kind(), detail);
        }
        return DetectorVerdict.anomalous(kind(), AnomalyDetector.score(Math.abs(z) / config.getZscoreThreshold()),
                EnumSet.of(AnomalyType.TIME_PATTERN), detail);
    }

    static int bucketOf(long epochSecond, ZoneId zone, int hourGranularity) {
        int hour = Instant.ofEpochSecond(epochSecond).atZone(zone).getHour();
        return hour / Math.max(1, hourGranularity);
    }
}
