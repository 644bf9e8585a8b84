package com.shipAgent.geck.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Clock used to stamp survivors updated by a deduplication run.
 */
@Configuration
public class ClockConfig {
    
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
