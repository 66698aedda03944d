package com.blueprint.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans for the core services.
 */
@Configuration
public class CoreConfig {

    /** Source of "now" for session timestamps and timeline start dates. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
