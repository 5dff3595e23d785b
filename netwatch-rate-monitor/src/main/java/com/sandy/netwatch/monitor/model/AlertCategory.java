package com.sandy.netwatch.monitor.model;

/**
 * What an alert record is about. Health and configuration categories describe the monitor itself,
 * the others describe the monitored traffic.
 */
public enum AlertCategory {
    THRESHOLD_VIOLATION(false),
    THRESHOLD_CLEARED(false),
    ANOMALY(false),
    STORAGE_HEALTH(true),
    SYSTEM_HEALTH(true),
    CONFIGURATION(true);

    private final boolean monitorHealth;

    AlertCategory(boolean monitorHealth) {
        this.monitorHealth = monitorHealth;
    }

    public boolean isMonitorHealth() {
        return monitorHealth;
    }
}
