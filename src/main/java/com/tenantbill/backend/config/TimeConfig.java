package com.tenantbill.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Provides a single source of truth for time across the app.
 * Inject the Clock instead of calling OffsetDateTime.now(ZoneOffset.UTC) in services.
 */
@Configuration
public class TimeConfig {
    @Bean
    public Clock appClock() {
        return Clock.systemUTC();
    }
}
