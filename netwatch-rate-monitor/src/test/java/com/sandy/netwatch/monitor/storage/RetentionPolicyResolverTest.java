package com.sandy.netwatch.monitor.storage;

import com.sandy.netwatch.monitor.model.AggregationFunction;
import com.sandy.netwatch.monitor.model.RetentionPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RetentionPolicyResolverTest {

    private static RetentionPolicy policy(String name, String pattern) {
        return new RetentionPolicy(name, pattern, Duration.ofHours(1), Duration.ofSeconds(60), AggregationFunction.AVG, Duration.ofHours(24));
    }

    @Test
    void defaultsCoverEveryUnitAndAlarmHistory() {
        RetentionPolicyResolver resolver = new RetentionPolicyResolver(RetentionPolicyResolver.defaultPolicies());
        assertEquals("seconds", resolver.resolve("total:s").orElseThrow().name());
        assertEquals("minutes", resolver.resolve("total:m").orElseThrow().name());
        assertEquals("hours", resolver.resolve("errors:h").orElseThrow().name());
        RetentionPolicy alarm = resolver.resolve("total:s:alarm-history").orElseThrow();
        assertEquals("alarm-history", alarm.name());
        assertEquals(AggregationFunction.FIRST, alarm.function());
        assertTrue(resolver.resolve("unrelated").isEmpty());
    }

    @Test
    void mostSpecificPatternWins() {
        RetentionPolicyResolver resolver = new RetentionPolicyResolver(List.of(
                policy("generic", "*"),
                policy("seconds", "*:s"),
                policy("total-seconds", "total:s")));
        assertEquals("total-seconds", resolver.resolve("total:s").orElseThrow().name());
        assertEquals("seconds", resolver.resolve("bvlc:s").orElseThrow().name());
        assertEquals("generic", resolver.resolve("bvlc:m").orElseThrow().name());
    }

    @Test
    void tieGoesToFirstDeclared() {
        RetentionPolicyResolver resolver = new RetentionPolicyResolver(List.of(
                policy("by-prefix", "total*"),
                policy("by-suffix", "*tal:s")));
        // both have five literal characters
        assertEquals("by-prefix", resolver.resolve("total:s").orElseThrow().name());
        assertEquals("by-prefix", resolver.resolve("total:s").orElseThrow().name());
    }

    @Test
    void invalidPolicyIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RetentionPolicy("bad", "*:s",
                Duration.ofHours(2), Duration.ofSeconds(60), AggregationFunction.AVG, Duration.ofHours(1)));
        assertThrows(IllegalArgumentException.class, () -> new RetentionPolicy("bad", "*:s",
                Duration.ofHours(1), Duration.ZERO, AggregationFunction.AVG, Duration.ofHours(1)));
    }
}
