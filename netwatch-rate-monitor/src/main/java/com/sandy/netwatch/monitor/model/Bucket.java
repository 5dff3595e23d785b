package com.sandy.netwatch.monitor.model;

/**
 * One aggregated retention bucket.
 *
 * @param timestamp bucket start, epoch seconds aligned to the policy resolution
 * @param value     reduced value
 * @param count     raw samples folded into {@code value}
 */
public record Bucket(long timestamp, double value, long count) {

    public Bucket {
        if (count < 1) {
            throw new IllegalArgumentException("Bucket at " + timestamp + " must cover at least one sample, got " + count);
        }
    }

    public Sample toSample() {
        return new Sample(timestamp, value);
    }
}
