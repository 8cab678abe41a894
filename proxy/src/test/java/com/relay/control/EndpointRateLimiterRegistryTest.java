package com.relay.control;

import com.relay.support.TestClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class EndpointRateLimiterRegistryTest {

    private EndpointRateLimiterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new EndpointRateLimiterRegistry(100, 20, Duration.ofMinutes(5), new TestClock(), false);
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void unmatchedPathUsesDefault() {
        assertThat(registry.resolve("/anything")).isSameAs(registry.getDefaultLimiter());
    }

    @Test
    void longestPrefixWins() {
        registry.addEndpoint("/api/*", 50, 5);
        registry.addEndpoint("/api/orders", 10, 1);

        assertThat(registry.resolve("/api/orders/7").getBurst()).isEqualTo(1);
        assertThat(registry.resolve("/api/users").getBurst()).isEqualTo(5);
        assertThat(registry.resolve("/apiary").getBurst()).isEqualTo(20);
    }

    @Test
    void endpointBudgetsAreIndependent() {
        registry.addEndpoint("/login", 60, 1);

        assertThat(registry.allow("/login", "client")).isTrue();
        assertThat(registry.allow("/login", "client")).isFalse();
        assertThat(registry.allow("/other", "client")).isTrue();
    }

    @Test
    void replacingAnOverrideTakesEffect() {
        registry.addEndpoint("/login", 60, 1);
        registry.addEndpoint("/login/", 60, 3);

        assertThat(registry.resolve("/login").getBurst()).isEqualTo(3);
    }
}
