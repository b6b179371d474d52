package com.cdcportal.backend.global.config;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;
import org.springframework.data.domain.AuditorAware;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Audit columns take their timestamps from the application clock, stored as UTC,
 * and their account ids from the verified caller.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.cdcportal.backend.modules")
@EnableJpaAuditing(auditorAwareRef = "callerAuditorAware", dateTimeProviderRef = "clockDateTimeProvider")
public class JpaConfig {

    @Bean
    public AuditorAware<Long> callerAuditorAware() {
        return new CdcPortalAuditorAware();
    }

    @Bean
    public DateTimeProvider clockDateTimeProvider(Clock clock) {
        return () -> Optional.of(OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC));
    }
}
