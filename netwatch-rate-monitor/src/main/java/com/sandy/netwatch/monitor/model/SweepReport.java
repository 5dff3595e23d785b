package com.sandy.netwatch.monitor.model;

/**
 * Outcome of one retention pass over one key.
 */
public record SweepReport(String key,
                          String policy,
                          int rawBefore,
                          int rawAfter,
                          int aggregatedBefore,
                          int aggregatedAfter,
                          int bucketsCreated,
                          int aggregatesDropped) {

    public boolean changed() {
        return rawBefore != rawAfter || aggregatedBefore != aggregatedAfter || bucketsCreated > 0;
    }

    public static SweepReport unchanged(String key, String policy, int raw, int aggregated) {
        return new SweepReport(key, policy, raw, raw, aggregated, aggregated, 0, 0);
    }
}
