package com.example.airtime_backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Segment bounds, recent-session cutoffs and scheduler days are all computed in UTC from this clock.
 */
@Configuration
public class TimeConfig {
    @Bean
    public Clock utcClock() {
        return Clock.systemUTC();
    }
}
