package com.sandy.netwatch.monitor.model;

/**
 * Sampling granularity of a monitored key, encoded as the key's ":s", ":m" or ":h" suffix.
 */
public enum IntervalUnit {
    SECOND("s"),
    MINUTE("m"),
    HOUR("h");

    private final String suffix;

    IntervalUnit(String suffix) {
        this.suffix = suffix;
    }

    public String getSuffix() {
        return suffix;
    }

    public static IntervalUnit fromIntervalSeconds(long intervalSeconds) {
        if (intervalSeconds <= 1) return SECOND;
        if (intervalSeconds <= 60) return MINUTE;
        return HOUR;
    }

    /**
     * Unit named by the key suffix, falling back to the interval when the key carries none.
     */
    public static IntervalUnit forKey(String key, long intervalSeconds) {
        int idx = key == null ? -1 : key.lastIndexOf(':');
        if (idx >= 0 && idx < key.length() - 1) {
            String suffix = key.substring(idx + 1);
            for (IntervalUnit unit : values()) {
                if (unit.suffix.equals(suffix)) return unit;
            }
        }
        return fromIntervalSeconds(intervalSeconds);
    }
}
