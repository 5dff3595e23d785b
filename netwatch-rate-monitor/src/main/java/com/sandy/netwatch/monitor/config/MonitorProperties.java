package com.sandy.netwatch.monitor.config;

import com.sandy.netwatch.monitor.model.DetectorKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Settings under {@code monitor.*}. Global detector bounds fail startup when violated; per-metric and
 * retention entries are checked one by one by {@link com.sandy.netwatch.monitor.service.impl.ThresholdConfigValidator}
 * so that a bad entry only drops that entry.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "monitor")
public class MonitorProperties {

    /** Multiple of a key's interval after which a key without a successful tick is reported stale. */
    @Min(2)
    private int staleFactor = 3;

    @Valid
    private Detection detection = new Detection();

    /** Monitored counters. When empty a single {@code total:s} metric is used. */
    private List<Metric> metrics = new ArrayList<>();

    @Valid
    private Storage storage = new Storage();

    @Valid
    private Scheduler scheduler = new Scheduler();

    @Valid
    private Alert alert = new Alert();

    @Data
    public static class Detection {
        @DecimalMin("0.1") @DecimalMax("10.0")
        private double sensitivity = 1.0;
        @DecimalMin("1.0") @DecimalMax("10.0")
        private double spikeSensitivity = 2.0;
        @Min(1)
        private int spikeLookback = 4;
        @DecimalMin("1.0") @DecimalMax("10.0")
        private double zscoreThreshold = 3.0;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double trendThreshold = 0.2;
        @Min(2)
        private int trendWindow = 10;
        @Min(1) @Max(24)
        private int hourGranularity = 1;
        @Min(2)
        private int minHistory = 10;
        @Min(2)
        private int minBucketHistory = 3;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double reportThreshold = 0.5;
        /** Samples handed to the detectors on each tick. */
        @Min(10)
        private int windowSize = 600;
        /** Anomaly events kept per key. */
        @Min(1)
        private int historySize = 100;
        /** Days of time-of-day baseline kept per key. */
        @Min(1) @Max(90)
        private int baselineDays = 7;
        /** Zone used for time-of-day buckets; blank means the system zone. */
        private String zone = "";
        private Map<DetectorKind, Double> weights = new EnumMap<>(DetectorKind.class);
    }

    @Data
    public static class Metric {
        private String key;
        private long intervalSeconds = 1;
        private double maxValue = 20;
        private int consecutiveDuration = 30;
        private int maxSamples = 3600;
    }

    @Data
    public static class Storage {
        private boolean compressionEnabled = true;
        @Min(0) @Max(9)
        private int compressionLevel = 6;
        @Min(0)
        private int minCompressionSize = 100;
        @Min(1)
        private long operationTimeoutMs = 2000;
        @Min(1)
        private int maxAttempts = 3;
        @Min(0)
        private long initialBackoffMs = 100;
        @DecimalMin("1.0")
        private double backoffMultiplier = 2.0;
        @Min(1)
        private int executorThreads = 4;
        @Min(1)
        private int executorQueueCapacity = 1000;
        @Valid
        private Retention retention = new Retention();
    }

    @Data
    public static class Retention {
        @Min(1000)
        private long sweepIntervalMs = 300000;
        /** When empty the built-in per-unit policies apply. */
        private List<Policy> policies = new ArrayList<>();
    }

    @Data
    public static class Policy {
        private String name;
        private String pattern;
        private double rawHours;
        private long resolutionSeconds;
        private String aggregationFunction = "avg";
        /** Defaults to {@code rawHours} when not set. */
        private Double archiveHours;
    }

    @Data
    public static class Scheduler {
        @Min(1)
        private int poolSize = 4;
        @Min(0)
        private int shutdownGraceSeconds = 10;
    }

    @Data
    public static class Alert {
        @Min(0)
        private int duplicateSuppressMinutes = 5;
        @Min(1)
        private int recentLimit = 50;
    }
}
