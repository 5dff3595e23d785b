package com.sandy.netwatch.monitor.model;

public enum AnomalyType {
    THRESHOLD,
    SPIKE,
    STATISTICAL,
    TIME_PATTERN,
    INCREASING_TREND,
    DECREASING_TREND
}
