package com.tasktracker.backend.global.config;

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
 * Verifies required settings once the application is up and refuses to keep
 * running with a missing signing secret or nonsensical token lifetimes.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String PLACEHOLDER_SECRET = "change-me-in-production";

    private static final long MIN_ACCESS_TTL_MILLIS = 60_000L;          // 1 minute
    private static final long MAX_ACCESS_TTL_MILLIS = 86_400_000L;      // 24 hours
    private static final long MAX_REFRESH_TTL_MILLIS = 7_776_000_000L;  // 90 days

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "jwt.refresh-expiration"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration problem: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Configuration validated");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            if (property(key).isEmpty()) {
                problems.add(key + " is missing");
            }
        }

        property("jwt.secret")
                .filter(PLACEHOLDER_SECRET::equals)
                .ifPresent(secret -> problems.add("jwt.secret still holds the placeholder value"));

        Optional<Long> accessTtl = parseMillis("jwt.expiration", problems);
        Optional<Long> refreshTtl = parseMillis("jwt.refresh-expiration", problems);

        accessTtl.filter(ttl -> ttl < MIN_ACCESS_TTL_MILLIS || ttl > MAX_ACCESS_TTL_MILLIS)
                .ifPresent(ttl -> problems.add("jwt.expiration must be between "
                        + MIN_ACCESS_TTL_MILLIS + " and " + MAX_ACCESS_TTL_MILLIS + " ms"));
        refreshTtl.filter(ttl -> ttl > MAX_REFRESH_TTL_MILLIS)
                .ifPresent(ttl -> problems.add("jwt.refresh-expiration must not exceed " + MAX_REFRESH_TTL_MILLIS + " ms"));
        if (accessTtl.isPresent() && refreshTtl.isPresent() && refreshTtl.get() <= accessTtl.get()) {
            problems.add("jwt.refresh-expiration must be longer than jwt.expiration");
        }
        return problems;
    }

    private Optional<Long> parseMillis(String key, List<String> problems) {
        Optional<String> raw = property(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(raw.get()));
        } catch (NumberFormatException e) {
            problems.add(key + " must be a number of milliseconds");
            return Optional.empty();
        }
    }

    private Optional<String> property(String key) {
        return Optional.ofNullable(environment.getProperty(key))
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }
}
