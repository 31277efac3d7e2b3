package com.example.airtime_backend.config;

import com.example.airtime_backend.eligibility.EligibilityEngine;
import com.example.airtime_backend.merge.SegmentMergePlanner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {

    @Bean
    public SegmentMergePlanner segmentMergePlanner(PipelineProperties properties) {
        return new SegmentMergePlanner(
                properties.getMerge().getShortSegmentSeconds(),
                Duration.ofSeconds(Math.max(0, properties.getMerge().getMaxGapSeconds())));
    }

    @Bean
    public EligibilityEngine eligibilityEngine() {
        return new EligibilityEngine();
    }
}
