package com.sandy.netwatch.monitor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.netwatch.monitor.model.DetectorConfig;
import com.sandy.netwatch.monitor.storage.BlockCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;

@Configuration
@EnableConfigurationProperties(MonitorProperties.class)
@Slf4j
public class MonitorConfig {

    @Bean
    public DetectorConfig detectorConfig(MonitorProperties properties) {
        MonitorProperties.Detection d = properties.getDetection();
        ZoneId zone = d.getZone() == null || d.getZone().isBlank() ? ZoneId.systemDefault() : ZoneId.of(d.getZone());
        DetectorConfig config = DetectorConfig.builder()
                .sensitivity(d.getSensitivity())
                .spikeSensitivity(d.getSpikeSensitivity())
                .spikeLookback(d.getSpikeLookback())
                .zscoreThreshold(d.getZscoreThreshold())
                .trendThreshold(d.getTrendThreshold())
                .trendWindow(d.getTrendWindow())
                .hourGranularity(d.getHourGranularity())
                .minHistory(d.getMinHistory())
                .minBucketHistory(d.getMinBucketHistory())
                .reportThreshold(d.getReportThreshold())
                .zone(zone)
                .weights(d.getWeights())
                .build();
        log.info("Detector config: sensitivity={} spikeSensitivity={} zscoreThreshold={} trendThreshold={} hourGranularity={} zone={} weights={}",
                config.getSensitivity(), config.getSpikeSensitivity(), config.getZscoreThreshold(),
                config.getTrendThreshold(), config.getHourGranularity(), zone, config.getWeights());
        return config;
    }

    @Bean
    public BlockCodec blockCodec(MonitorProperties properties, ObjectMapper objectMapper) {
        MonitorProperties.Storage s = properties.getStorage();
        return new BlockCodec(objectMapper, s.isCompressionEnabled(), s.getCompressionLevel(), s.getMinCompressionSize());
    }
}
