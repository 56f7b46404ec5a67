package com.fuelcopilot.behavior.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Clock Configuration for time-dependent code
 *
 * <p>Eviction cutoffs, score timestamps and cross-validation timestamps all read
 * "now" from this clock. Telemetry days are UTC, so the clock is UTC as well.
 */
@Configuration
public class ClockConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
