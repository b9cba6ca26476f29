package com.govcomms.collector.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /**
     * Timestamps are stored in UTC.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
