package com.relay.config;

import com.relay.control.CircuitBreakerSettings;
import com.relay.control.RetryPolicy;
import com.relay.model.RouteEntry;
import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Data
public class RelayProperties {

    private List<RouteDefinition> routes = new ArrayList<>();
    private Map<String, List<InstanceDefinition>> services = new LinkedHashMap<>();
    private RateLimit rateLimit = new RateLimit();
    private Breaker circuitBreaker = new Breaker();
    private Retry retry = new Retry();
    private Dispatch dispatch = new Dispatch();
    private Cache cache = new Cache();

    @Data
    public static class RouteDefinition {
        private String prefix;
        private String service;
        private boolean stripPrefix = true;
        private Limit rateLimit;

        public RouteEntry toEntry() {
            return RouteEntry.builder()
                    .pathPrefix(prefix)
                    .serviceName(service)
                    .stripPrefix(stripPrefix)
                    .rateLimit(rateLimit != null
                            ? new RouteEntry.RateLimit(rateLimit.getRatePerMinute(), rateLimit.getBurst())
                            : null)
                    .build();
        }
    }

    @Data
    public static class InstanceDefinition {
        private String id;
        private String url;
        private int weight = 100;
    }

    @Data
    public static class Limit {
        private int ratePerMinute;
        private int burst;
    }

    @Data
    public static class EndpointLimit {
        private String prefix;
        private int ratePerMinute;
        private int burst;
    }

    @Data
    public static class RateLimit {
        private int ratePerMinute = 100;
        private int burst = 20;
        private Duration cleanupInterval = Duration.ofMinutes(5);
        private boolean sweepEnabled = true;
        private List<EndpointLimit> endpoints = new ArrayList<>();
    }

    @Data
    public static class Breaker {
        private int maxHalfOpenProbes = 3;
        private Duration closedWindow = Duration.ofSeconds(60);
        private Duration openTimeout = Duration.ofSeconds(30);
        private int minRequestThreshold = 5;
        private double failureRateThreshold = 0.5;
        private Map<String, Breaker> services = new LinkedHashMap<>();

        public CircuitBreakerSettings toSettings() {
            return CircuitBreakerSettings.builder()
                    .maxHalfOpenProbes(maxHalfOpenProbes)
                    .closedWindow(closedWindow)
                    .openTimeout(openTimeout)
                    .minRequestThreshold(minRequestThreshold)
                    .failureRateThreshold(failureRateThreshold)
                    .build();
        }
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofMillis(100);
        private Duration maxDelay = Duration.ofSeconds(10);
        private double multiplier = 2.0;
        private boolean jitter = true;
        private Set<Integer> retryableStatuses = new LinkedHashSet<>(RetryPolicy.RETRYABLE_HTTP_STATUSES);

        public RetryPolicy toPolicy() {
            return RetryPolicy.builder()
                    .maxAttempts(maxAttempts)
                    .initialDelay(initialDelay)
                    .maxDelay(maxDelay)
                    .multiplier(multiplier)
                    .jitter(jitter)
                    .build();
        }
    }

    @Data
    public static class Dispatch {
        private Duration timeout = Duration.ofSeconds(25);
        private Duration requestTimeout = Duration.ofSeconds(10);
        private Duration connectTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Cache {
        // memory, redis or none
        private String type = "memory";
        private Duration ttl = Duration.ofMinutes(5);
        private String keyPrefix = "proxy";
    }
}
