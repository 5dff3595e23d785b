package com.sandy.netwatch.monitor.model;

/**
 * The closed set of detection strategies run by the detection manager.
 */
public enum DetectorKind {
    THRESHOLD,
    STATISTICAL,
    TIME_AWARE,
    TREND
}
