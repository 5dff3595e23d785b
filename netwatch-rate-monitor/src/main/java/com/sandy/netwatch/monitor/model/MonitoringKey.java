package com.sandy.netwatch.monitor.model;

/**
 * Identity of a monitored series.
 *
 * @param id         counter name plus interval suffix, e.g. {@code total:s}
 * @param unit       sampling granularity
 * @param maxSamples hard cap on retained raw samples
 */
public record MonitoringKey(String id, IntervalUnit unit, int maxSamples) {

    public MonitoringKey {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Monitoring key id must not be blank");
        }
        if (maxSamples <= 0) {
            throw new IllegalArgumentException("maxSamples must be > 0 for key " + id + ", got " + maxSamples);
        }
    }

    public static MonitoringKey of(ThresholdConfig config) {
        return new MonitoringKey(config.monitoredKey(),
                IntervalUnit.forKey(config.monitoredKey(), config.intervalSeconds()),
                config.maxSamples());
    }

    /** Counter name without the interval suffix. */
    public String counterName() {
        return counterNameOf(id);
    }

    /** Strips a trailing {@code :s}, {@code :m} or {@code :h}. */
    public static String counterNameOf(String key) {
        for (IntervalUnit u : IntervalUnit.values()) {
            String suffix = ":" + u.getSuffix();
            if (key.endsWith(suffix) && key.length() > suffix.length()) {
                return key.substring(0, key.length() - suffix.length());
            }
        }
        return key;
    }

    public String alarmHistoryKey() {
        return id + ":alarm-history";
    }
}
