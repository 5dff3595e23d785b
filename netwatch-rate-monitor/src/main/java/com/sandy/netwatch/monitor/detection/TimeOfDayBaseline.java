package com.sandy.netwatch.monitor.detection;

import com.sandy.netwatch.monitor.model.Sample;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.TreeMap;

/**
 * Running mean and deviation per time-of-day bucket, kept per calendar day for the last {@code days} days.
 * One instance belongs to one key and is only touched by that key's tick.
 */
public class TimeOfDayBaseline {

    private final ZoneId zone;
    private final int hourGranularity;
    private final int days;
    private final TreeMap<LocalDate, Moments[]> byDay = new TreeMap<>();

    public TimeOfDayBaseline(ZoneId zone, int hourGranularity, int days) {
        if (days < 1) {
            throw new IllegalArgumentException("Baseline must span at least one day, got " + days);
        }
        this.zone = zone;
        this.hourGranularity = Math.max(1, hourGranularity);
        this.days = days;
    }

    /** Seconds of history the baseline can hold. */
    public long spanSeconds() {
        return (long) days * 86400;
    }

    public int bucketOf(long epochSecond) {
        return TimeAwareDetector.bucketOf(epochSecond, zone, hourGranularity);
    }

    public void observe(Sample sample) {
        ZonedDateTime at = Instant.ofEpochSecond(sample.timestamp()).atZone(zone);
        LocalDate day = at.toLocalDate();
        LocalDate oldest = byDay.isEmpty() ? day : byDay.lastKey().minusDays(days - 1L);
        if (day.isBefore(oldest)) return;
        Moments[] buckets = byDay.computeIfAbsent(day, d -> new Moments[24 / hourGranularity + 1]);
        int bucket = at.getHour() / hourGranularity;
        if (buckets[bucket] == null) buckets[bucket] = new Moments();
        buckets[bucket].add(sample.value());
        LocalDate cutoff = byDay.lastKey().minusDays(days - 1L);
        byDay.headMap(cutoff, false).clear();
    }

    public void observeAll(Collection<Sample> samples) {
        for (Sample s : samples) observe(s);
    }

    /** Statistics of every retained observation in the bucket {@code epochSecond} falls in. */
    public WindowStatistics statisticsAt(long epochSecond) {
        int bucket = bucketOf(epochSecond);
        Moments total = new Moments();
        for (Moments[] buckets : byDay.values()) {
            if (buckets[bucket] != null) total.merge(buckets[bucket]);
        }
        return total.toStatistics();
    }

    /** Welford accumulator; {@link #merge} is the pairwise combination of two of them. */
    private static final class Moments {
        private long count;
        private double mean;
        private double m2;

        void add(double value) {
            count++;
            double d = value - mean;
            mean += d / count;
            m2 += d * (value - mean);
        }

        void merge(Moments other) {
            if (other.count == 0) return;
            long n = count + other.count;
            double d = other.mean - mean;
            mean += d * other.count / n;
            m2 += other.m2 + d * d * count * other.count / n;
            count = n;
        }

        WindowStatistics toStatistics() {
            if (count == 0) return new WindowStatistics(0, 0, 0);
            double stddev = count < 2 ? 0 : Math.sqrt(m2 / (count - 1));
            return new WindowStatistics((int) Math.min(Integer.MAX_VALUE, count), mean, stddev);
        }
    }
}
