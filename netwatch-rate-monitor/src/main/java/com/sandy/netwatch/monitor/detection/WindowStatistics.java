package com.sandy.netwatch.monitor.detection;

import com.sandy.netwatch.monitor.model.Sample;

import java.util.List;

/**
 * Mean and sample standard deviation of a set of values.
 */
public record WindowStatistics(int count, double mean, double stddev) {

    public static WindowStatistics of(List<Sample> samples) {
        int n = samples.size();
        if (n == 0) return new WindowStatistics(0, 0, 0);
        double sum = 0;
        for (Sample s : samples) sum += s.value();
        double mean = sum / n;
        if (n == 1) return new WindowStatistics(1, mean, 0);
        double sq = 0;
        for (Sample s : samples) {
            double d = s.value() - mean;
            sq += d * d;
        }
        return new WindowStatistics(n, mean, Math.sqrt(sq / (n - 1)));
    }

    /** z-score of {@code value} with the deviation floored at {@code floor}. */
    public double zScore(double value, double floor) {
        return (value - mean) / Math.max(stddev, floor);
    }
}
