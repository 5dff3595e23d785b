package com.sandy.netwatch.monitor.storage;

import com.sandy.netwatch.monitor.model.Bucket;
import com.sandy.netwatch.monitor.model.RetentionPolicy;
import com.sandy.netwatch.monitor.model.Sample;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Pure retention step for one series: collapses raw samples past the raw cutoff into buckets and drops
 * aggregates past the archive cutoff.
 */
public final class SeriesAggregator {

    private SeriesAggregator() {}

    public record Result(List<Sample> raw, List<Bucket> aggregates, int bucketsCreated, int aggregatesDropped) {
    }

    /**
     * Every raw sample older than {@code now - rawRetention} is collapsed. A bucket that straddles the cutoff is
     * created from the part that has aged out, and later passes fold the rest into it through
     * {@link com.sandy.netwatch.monitor.model.AggregationFunction#merge}.
     *
     * @param nowEpoch current time in epoch seconds
     */
    public static Result apply(List<Sample> raw, List<Bucket> aggregates, RetentionPolicy policy, long nowEpoch) {
        long resolution = policy.resolution().getSeconds();
        long rawCutoff = nowEpoch - policy.rawRetention().getSeconds();
        long archiveCutoff = nowEpoch - policy.archiveRetention().getSeconds();

        TreeMap<Long, List<Double>> collapsed = new TreeMap<>();
        List<Sample> keptRaw = new ArrayList<>(raw.size());
        for (Sample s : raw) {
            if (s.timestamp() < rawCutoff) {
                long bucket = Math.floorDiv(s.timestamp(), resolution) * resolution;
                collapsed.computeIfAbsent(bucket, b -> new ArrayList<>()).add(s.value());
            } else {
                keptRaw.add(s);
            }
        }

        TreeMap<Long, Bucket> merged = new TreeMap<>();
        for (Bucket a : aggregates) merged.put(a.timestamp(), a);
        int created = 0;
        for (Map.Entry<Long, List<Double>> e : collapsed.entrySet()) {
            long start = e.getKey();
            List<Double> values = e.getValue();
            double reduced = policy.function().apply(values);
            Bucket existing = merged.get(start);
            if (existing == null) {
                merged.put(start, new Bucket(start, reduced, values.size()));
                created++;
            } else {
                double value = policy.function().merge(existing.value(), existing.count(), reduced, values.size());
                merged.put(start, new Bucket(start, value, existing.count() + values.size()));
            }
        }

        int dropped = 0;
        List<Bucket> keptAggregates = new ArrayList<>(merged.size());
        for (Bucket a : merged.values()) {
            if (a.timestamp() < archiveCutoff) {
                dropped++;
            } else {
                keptAggregates.add(a);
            }
        }
        return new Result(keptRaw, keptAggregates, created, dropped);
    }
}
