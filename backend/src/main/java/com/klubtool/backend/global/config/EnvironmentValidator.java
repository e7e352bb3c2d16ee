package com.klubtool.backend.global.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
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
 * Fails startup when required settings are missing or unusable.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEV_JWT_SECRET = "dev-jwt-secret-key-change-in-production-klubtool";

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "app.cors.allowed-origins",
            "app.security.login-url"
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
        for (String property : REQUIRED_PROPERTIES) {
            String value = environment.getProperty(property);
            if (value == null || value.isBlank()) {
                problems.add(property + " is required");
            }
        }

        boolean productionProfile = List.of(environment.getActiveProfiles()).contains("prod");
        Optional<String> jwtSecret = Optional.ofNullable(environment.getProperty("jwt.secret"));
        if (productionProfile && jwtSecret.filter(DEV_JWT_SECRET::equals).isPresent()) {
            problems.add("jwt.secret must be replaced with a random value");
        }

        Optional<String> jwtExpiration = Optional.ofNullable(environment.getProperty("jwt.expiration"));
        if (jwtExpiration.isPresent()) {
            try {
                long expiration = Long.parseLong(jwtExpiration.get().trim());
                if (expiration < 300000 || expiration > 86400000) {
                    problems.add("jwt.expiration must be between 300000 and 86400000 milliseconds");
                }
            } catch (NumberFormatException e) {
                problems.add("jwt.expiration must be numeric");
            }
        }

        checkDuration("app.calendar.feed-lookback", problems);
        checkDuration("app.calendar.event-duration", problems);
        return problems;
    }

    private void checkDuration(String property, List<String> problems) {
        String raw = environment.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return;
        }
        try {
            Duration duration = Duration.parse(raw.trim());
            if (duration.isNegative() || duration.isZero()) {
                problems.add(property + " must be positive");
            }
        } catch (DateTimeParseException e) {
            problems.add(property + " must be an ISO-8601 duration");
        }
    }
}
