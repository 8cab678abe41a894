package com.relay.control;

import com.relay.support.TestClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class CircuitBreakerRegistryTest {

    @Test
    void returnsSameBreakerForSameService() {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(CircuitBreakerSettings.defaults());

        CircuitBreaker first = registry.get("orders");
        CircuitBreaker second = registry.get("orders");

        assertThat(first).isSameAs(second);
        assertThat(registry.get("users")).isNotSameAs(first);
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void findDoesNotCreate() {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(CircuitBreakerSettings.defaults());

        assertThat(registry.find("orders")).isEmpty();
        assertThat(registry.size()).isZero();
    }

    @Test
    void appliesPerServiceOverrides() {
        CircuitBreakerSettings strict = CircuitBreakerSettings.builder()
                .maxHalfOpenProbes(1)
                .openTimeout(Duration.ofSeconds(5))
                .minRequestThreshold(2)
                .failureRateThreshold(0.25)
                .build();

        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(
                CircuitBreakerSettings.defaults(), Map.of("payments", strict), null, new TestClock());

        assertThat(registry.get("payments").getSettings().getMinRequestThreshold()).isEqualTo(2);
        assertThat(registry.get("payments").getSettings().getClosedWindow()).isEqualTo(Duration.ofSeconds(60));
        assertThat(registry.get("orders").getSettings()).isEqualTo(CircuitBreakerSettings.defaults());
    }

    @Test
    void concurrentLookupsCreateOneBreaker() throws Exception {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(CircuitBreakerSettings.defaults());
        Set<CircuitBreaker> seen = ConcurrentHashMap.newKeySet();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(8);

        try {
            for (int i = 0; i < 32; i++) {
                executor.submit(() -> {
                    start.await();
                    seen.add(registry.get("orders"));
                    return null;
                });
            }
            start.countDown();
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(seen).hasSize(1);
        assertThat(registry.getAll()).hasSize(1);
    }
}
