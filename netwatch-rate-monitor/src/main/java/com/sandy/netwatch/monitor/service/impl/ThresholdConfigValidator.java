package com.sandy.netwatch.monitor.service.impl;

import com.sandy.netwatch.monitor.config.MonitorProperties;
import com.sandy.netwatch.monitor.model.AggregationFunction;
import com.sandy.netwatch.monitor.model.RetentionPolicy;
import com.sandy.netwatch.monitor.model.ThresholdConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks metric and retention entries one by one. A rejected entry is logged, reported as a CONFIGURATION alert
 * and left out; the remaining entries still apply.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ThresholdConfigValidator {

    static final String DEFAULT_KEY = "total:s";

    private final HealthReporter healthReporter;

    public List<ThresholdConfig> validateMetrics(List<MonitorProperties.Metric> metrics) {
        if (metrics == null || metrics.isEmpty()) {
            log.info("No metrics configured, monitoring default key={}", DEFAULT_KEY);
            return List.of(new ThresholdConfig(DEFAULT_KEY, 1, 20, 30, 3600));
        }
        List<ThresholdConfig> valid = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < metrics.size(); i++) {
            MonitorProperties.Metric m = metrics.get(i);
            String subject = "monitor.metrics[" + i + "]";
            String reason = checkMetric(m, seen);
            if (reason != null) {
                healthReporter.configurationError(subject, reason, describe(m));
                continue;
            }
            seen.add(m.getKey());
            valid.add(new ThresholdConfig(m.getKey(), m.getIntervalSeconds(), m.getMaxValue(), m.getConsecutiveDuration(), m.getMaxSamples()));
        }
        return valid;
    }

    private String checkMetric(MonitorProperties.Metric m, Set<String> seen) {
        if (m.getKey() == null || m.getKey().isBlank()) return "key is blank";
        if (!m.getKey().equals(m.getKey().trim()) || m.getKey().chars().anyMatch(Character::isWhitespace)) return "key contains whitespace";
        if (seen.contains(m.getKey())) return "duplicate key " + m.getKey();
        if (m.getIntervalSeconds() < 1) return "interval-seconds must be >= 1";
        if (Double.isNaN(m.getMaxValue()) || Double.isInfinite(m.getMaxValue()) || m.getMaxValue() < 0) return "max-value must be a finite number >= 0";
        if (m.getConsecutiveDuration() < 1) return "consecutive-duration must be >= 1";
        if (m.getMaxSamples() < 1) return "max-samples must be >= 1";
        return null;
    }

    /**
     * @return the valid policies in declaration order, or the built-in ones when none are configured or none
     * survive validation
     */
    public List<RetentionPolicy> validatePolicies(List<MonitorProperties.Policy> policies, List<RetentionPolicy> defaults) {
        if (policies == null || policies.isEmpty()) {
            return defaults;
        }
        List<RetentionPolicy> valid = new ArrayList<>();
        for (int i = 0; i < policies.size(); i++) {
            MonitorProperties.Policy p = policies.get(i);
            String subject = "monitor.storage.retention.policies[" + i + "]";
            try {
                if (!(p.getRawHours() > 0)) throw new IllegalArgumentException("raw-hours must be > 0");
                if (p.getArchiveHours() != null && !(p.getArchiveHours() > 0)) throw new IllegalArgumentException("archive-hours must be > 0");
                Duration raw = hours(p.getRawHours());
                Duration archive = p.getArchiveHours() == null ? raw : hours(p.getArchiveHours());
                String name = p.getName() == null || p.getName().isBlank() ? p.getPattern() : p.getName();
                valid.add(new RetentionPolicy(name, p.getPattern(), raw, Duration.ofSeconds(p.getResolutionSeconds()),
                        AggregationFunction.parse(p.getAggregationFunction()), archive));
            } catch (IllegalArgumentException e) {
                healthReporter.configurationError(subject, e.getMessage(), describe(p));
            }
        }
        if (valid.isEmpty()) {
            log.warn("No valid retention policy configured, using built-in defaults");
            return defaults;
        }
        return valid;
    }

    private static Duration hours(double hours) {
        return Duration.ofSeconds(Math.round(hours * 3600));
    }

    private static Map<String, Object> describe(MonitorProperties.Metric m) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("key", m.getKey());
        d.put("intervalSeconds", m.getIntervalSeconds());
        d.put("maxValue", m.getMaxValue());
        d.put("consecutiveDuration", m.getConsecutiveDuration());
        d.put("maxSamples", m.getMaxSamples());
        return d;
    }

    private static Map<String, Object> describe(MonitorProperties.Policy p) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("name", p.getName());
        d.put("pattern", p.getPattern());
        d.put("rawHours", p.getRawHours());
        d.put("resolutionSeconds", p.getResolutionSeconds());
        d.put("aggregationFunction", p.getAggregationFunction());
        d.put("archiveHours", p.getArchiveHours());
        return d;
    }
}
