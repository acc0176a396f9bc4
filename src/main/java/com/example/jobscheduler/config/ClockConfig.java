package com.example.jobscheduler.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneOffset;

/**
 * Time source for scheduling decisions.
 * <p>
 * Ticks in whole milliseconds so that every instant the scheduler produces survives a
 * round trip through the database unchanged.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.tickMillis(ZoneOffset.UTC);
    }
}
