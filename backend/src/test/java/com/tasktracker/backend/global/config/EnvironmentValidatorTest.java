package com.tasktracker.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    private MockEnvironment environment;

    @BeforeEach
    void setUp() {
        environment = new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/tasktracker")
                .withProperty("jwt.secret", "a-perfectly-reasonable-signing-secret-value")
                .withProperty("jwt.expiration", "1800000")
                .withProperty("jwt.refresh-expiration", "604800000");
    }

    @Test
    void acceptsSaneConfiguration() {
        assertThat(new EnvironmentValidator(environment).collectProblems()).isEmpty();
    }

    @Test
    void reportsMissingAndPlaceholderSecret() {
        environment.setProperty("jwt.secret", " ");
        assertThat(new EnvironmentValidator(environment).collectProblems()).containsExactly("jwt.secret is missing");

        environment.setProperty("jwt.secret", EnvironmentValidator.PLACEHOLDER_SECRET);
        assertThat(new EnvironmentValidator(environment).collectProblems())
                .containsExactly("jwt.secret still holds the placeholder value");
    }

    @Test
    void reportsUnreasonableLifetimes() {
        environment.setProperty("jwt.expiration", "1000");
        environment.setProperty("jwt.refresh-expiration", "500");

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .anyMatch(problem -> problem.startsWith("jwt.expiration must be between"))
                .contains("jwt.refresh-expiration must be longer than jwt.expiration");
    }

    @Test
    void reportsNonNumericLifetime() {
        environment.setProperty("jwt.expiration", "30m");

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .containsExactly("jwt.expiration must be a number of milliseconds");
    }

    @Test
    void startupFailsOnProblems() {
        environment.setProperty("jwt.refresh-expiration", "1800000");

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("jwt.refresh-expiration must be longer than jwt.expiration");
    }
}
