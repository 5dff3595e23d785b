package com.sandy.netwatch.monitor.monitor;

import com.sandy.netwatch.monitor.model.AlertCategory;
import com.sandy.netwatch.monitor.model.AlertRecord;
import com.sandy.netwatch.monitor.model.Sample;
import com.sandy.netwatch.monitor.model.Severity;
import com.sandy.netwatch.monitor.model.ThresholdConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Consecutive-violation rule of one key.
 * <p>
 * The counter grows while {@code value > maxValue} and drops to zero otherwise. A violation record is produced
 * when the counter reaches {@code consecutiveDuration}, never on the ticks after it, so a sustained flood
 * yields one record; it can fire again only after the counter has been back to zero. The alarm stays active
 * until {@code consecutiveDuration} non-violating samples in a row, then a cleared record is produced and the
 * start/end pair is handed back for the alarm history.
 */
public class ThresholdTracker {

    static final double ESCALATION_FACTOR = 1.5;

    private final ThresholdConfig config;
    private int consecutiveViolations;
    private int consecutiveNormal;
    private boolean alarmActive;
    private long alarmSince;
    private boolean escalated;

    /**
     * @param clearedAlarm {@code (alarmStart, alarmEnd)} when this sample cleared an alarm, else {@code null}
     */
    public record Outcome(List<AlertRecord> records, Sample clearedAlarm) {
        static final Outcome NONE = new Outcome(Collections.emptyList(), null);
    }

    public ThresholdTracker(ThresholdConfig config) {
        this.config = config;
    }

    public synchronized Outcome observe(Sample sample) {
        double value = sample.value();
        double max = config.maxValue();
        List<AlertRecord> records = new ArrayList<>(1);
        Sample cleared = null;

        if (value > max) {
            consecutiveViolations++;
            consecutiveNormal = 0;
            if (consecutiveViolations == config.consecutiveDuration()) {
                boolean critical = value >= ESCALATION_FACTOR * max;
                if (!alarmActive) {
                    alarmActive = true;
                    alarmSince = sample.timestamp();
                    escalated = false;
                }
                escalated |= critical;
                records.add(violation(sample, critical ? Severity.CRITICAL : Severity.HIGH,
                        String.format("Threshold exceeded on %s: %.2f > %.2f for %d consecutive samples",
                                config.monitoredKey(), value, max, consecutiveViolations), false));
            } else if (alarmActive && !escalated && value >= ESCALATION_FACTOR * max) {
                escalated = true;
                records.add(violation(sample, Severity.CRITICAL,
                        String.format("Threshold violation escalated on %s: %.2f >= %.1fx max %.2f",
                                config.monitoredKey(), value, ESCALATION_FACTOR, max), true));
            }
        } else {
            consecutiveViolations = 0;
            if (alarmActive) {
                consecutiveNormal++;
                if (consecutiveNormal >= config.consecutiveDuration()) {
                    cleared = new Sample(alarmSince, sample.timestamp());
                    records.add(AlertRecord.builder()
                            .category(AlertCategory.THRESHOLD_CLEARED)
                            .severity(Severity.LOW)
                            .key(config.monitoredKey())
                            .message(String.format("Threshold alarm cleared on %s after %d s",
                                    config.monitoredKey(), sample.timestamp() - alarmSince))
                            .timestamp(sample.timestamp())
                            .detail("alarmStart", alarmSince)
                            .detail("alarmEnd", sample.timestamp())
                            .detail("value", value)
                            .detail("maxValue", max)
                            .build());
                    alarmActive = false;
                    alarmSince = 0;
                    escalated = false;
                    consecutiveNormal = 0;
                }
            }
        }
        return records.isEmpty() && cleared == null ? Outcome.NONE : new Outcome(records, cleared);
    }

    private AlertRecord violation(Sample sample, Severity severity, String message, boolean escalation) {
        return AlertRecord.builder()
                .category(AlertCategory.THRESHOLD_VIOLATION)
                .severity(severity)
                .key(config.monitoredKey())
                .message(message)
                .timestamp(sample.timestamp())
                .detail("value", sample.value())
                .detail("maxValue", config.maxValue())
                .detail("consecutiveDuration", config.consecutiveDuration())
                .detail("intervalSeconds", config.intervalSeconds())
                .detail("escalation", escalation)
                .build();
    }

    public synchronized int getConsecutiveViolations() {
        return consecutiveViolations;
    }

    public synchronized boolean isAlarmActive() {
        return alarmActive;
    }

    public synchronized long getAlarmSince() {
        return alarmSince;
    }
}
