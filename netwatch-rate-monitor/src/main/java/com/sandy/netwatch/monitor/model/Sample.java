package com.sandy.netwatch.monitor.model;

/**
 * One observation of a monitored counter.
 *
 * @param timestamp epoch seconds
 * @param value     sampled value
 */
public record Sample(long timestamp, double value) {
}
