package com.sandy.netwatch.monitor.model;

/**
 * Point-in-time view of one key's violation state, as seen by the global scan.
 *
 * @param lastTickEpoch epoch seconds of the last successful tick, 0 when none yet
 */
public record KeyStatus(String key,
                        long intervalSeconds,
                        double maxValue,
                        Double lastValue,
                        int consecutiveViolations,
                        int consecutiveDuration,
                        boolean alarmActive,
                        long alarmSince,
                        long lastTickEpoch,
                        int skippedTicks,
                        boolean stale) {
}
