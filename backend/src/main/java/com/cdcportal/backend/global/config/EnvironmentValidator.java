package com.cdcportal.backend.global.config;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails start-up when a required property is missing or out of range.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "app.cors.allowed-origins"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String property : REQUIRED_PROPERTIES) {
            String value = Optional.ofNullable(environment.getProperty(property)).map(String::trim).orElse("");
            if (value.isEmpty()) {
                problems.add(property + ": missing");
            }
        }

        Optional.ofNullable(environment.getProperty("jwt.expiration")).ifPresent(raw -> {
            try {
                long expiration = Long.parseLong(raw.trim());
                // 5 minutes .. 24 hours
                if (expiration < 300_000 || expiration > 86_400_000) {
                    problems.add("jwt.expiration: must be between 300000 and 86400000 milliseconds");
                }
            } catch (NumberFormatException ex) {
                problems.add("jwt.expiration: must be a number");
            }
        });

        Optional.ofNullable(environment.getProperty("app.time-zone")).ifPresent(raw -> {
            try {
                ZoneId.of(raw.trim());
            } catch (DateTimeException ex) {
                problems.add("app.time-zone: unknown zone " + raw);
            }
        });

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration - {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join("; ", problems));
        }
        log.info("Environment validation passed");
    }
}
