package com.sandy.netwatch.monitor.storage;

import com.sandy.netwatch.monitor.model.AggregationFunction;
import com.sandy.netwatch.monitor.model.RetentionPolicy;
import com.sandy.netwatch.monitor.tools.KeyPatternMatcher;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Picks the retention policy for a key: the matching pattern with the most literal characters. When two
 * matching patterns are equally specific the first declared one wins and a warning is logged once per key.
 */
@Slf4j
public class RetentionPolicyResolver {

    private final List<RetentionPolicy> policies;
    private final Set<String> warnedKeys = ConcurrentHashMap.newKeySet();

    public RetentionPolicyResolver(List<RetentionPolicy> policies) {
        this.policies = List.copyOf(policies);
    }

    public static List<RetentionPolicy> defaultPolicies() {
        List<RetentionPolicy> defaults = new ArrayList<>();
        defaults.add(new RetentionPolicy("seconds", "*:s", Duration.ofHours(1), Duration.ofSeconds(60), AggregationFunction.AVG, Duration.ofHours(24)));
        defaults.add(new RetentionPolicy("minutes", "*:m", Duration.ofHours(24), Duration.ofSeconds(600), AggregationFunction.AVG, Duration.ofDays(7)));
        defaults.add(new RetentionPolicy("hours", "*:h", Duration.ofDays(7), Duration.ofSeconds(3600), AggregationFunction.AVG, Duration.ofDays(30)));
        defaults.add(new RetentionPolicy("alarm-history", "*:alarm-history", Duration.ofDays(30), Duration.ofSeconds(1), AggregationFunction.FIRST, Duration.ofDays(30)));
        return defaults;
    }

    public List<RetentionPolicy> getPolicies() {
        return policies;
    }

    public Optional<RetentionPolicy> resolve(String key) {
        RetentionPolicy best = null;
        int bestScore = -1;
        boolean tie = false;
        for (RetentionPolicy p : policies) {
            if (!KeyPatternMatcher.matches(p.keyPattern(), key)) continue;
            int score = KeyPatternMatcher.specificity(p.keyPattern());
            if (score > bestScore) {
                best = p;
                bestScore = score;
                tie = false;
            } else if (score == bestScore) {
                tie = true;
            }
        }
        if (tie && warnedKeys.add(key)) {
            log.warn("Ambiguous retention policies for key={}: several patterns with specificity {} match, using first declared policy={}", key, bestScore, best.name());
        }
        return Optional.ofNullable(best);
    }
}
