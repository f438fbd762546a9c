package com.marketpulse.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the system {@link Clock} used for event, state and notification timestamps
 * and for throttle/retention arithmetic. Tests construct components with a fixed or
 * mutable clock instead.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
