package com.sandy.netwatch.monitor.config;

import com.sandy.netwatch.monitor.detection.DetectionManager;
import com.sandy.netwatch.monitor.service.DetectionStrategy;
import com.sandy.netwatch.monitor.service.impl.EnhancedDetectionStrategy;
import com.sandy.netwatch.monitor.service.impl.LegacyDetectionStrategy;
import com.sandy.netwatch.monitor.service.impl.ThresholdConfigValidator;
import com.sandy.netwatch.monitor.storage.RetentionPolicyResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Strategy objects chosen once at startup.
 */
@Configuration
@Slf4j
public class DetectionStrategyConfig {

    @Bean
    public DetectionStrategy detectionStrategy(@Value("${monitor.use-enhanced-detection:true}") boolean useEnhanced,
                                               DetectionManager detectionManager) {
        DetectionStrategy strategy = useEnhanced ? new EnhancedDetectionStrategy(detectionManager) : new LegacyDetectionStrategy();
        log.info("Detection strategy selected: {}", strategy.name());
        return strategy;
    }

    @Bean
    public RetentionPolicyResolver retentionPolicyResolver(MonitorProperties properties, ThresholdConfigValidator validator) {
        RetentionPolicyResolver resolver = new RetentionPolicyResolver(validator.validatePolicies(
                properties.getStorage().getRetention().getPolicies(), RetentionPolicyResolver.defaultPolicies()));
        resolver.getPolicies().forEach(p -> log.info("Retention policy name={} pattern={} raw={} resolution={} function={} archive={}",
                p.name(), p.keyPattern(), p.rawRetention(), p.resolution(), p.function(), p.archiveRetention()));
        return resolver;
    }
}
