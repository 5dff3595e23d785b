package com.sandy.netwatch.monitor.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Record handed to the alerting collaborator.
 */
@Value
@Builder
public class AlertRecord {
    AlertCategory category;
    Severity severity;
    String key;
    String message;
    /** Epoch seconds. */
    long timestamp;
    @Singular
    Map<String, Object> details;
}
