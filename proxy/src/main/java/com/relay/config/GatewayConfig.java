package com.relay.config;

import com.relay.cache.ResponseCache;
import com.relay.control.CircuitBreakerRegistry;
import com.relay.control.CircuitBreakerSettings;
import com.relay.control.CircuitStateListener;
import com.relay.control.EndpointRateLimiterRegistry;
import com.relay.control.RetryExecutor;
import com.relay.model.RouteEntry;
import com.relay.proxy.BackendClient;
import com.relay.proxy.ResilientDispatcher;
import com.relay.proxy.RouteTable;
import com.relay.proxy.ServiceRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Configuration
public class GatewayConfig {

    @Bean
    @ConfigurationProperties(prefix = "relay")
    public RelayProperties relayProperties() {
        return new RelayProperties();
    }

    @Bean
    public ServiceRegistry serviceRegistry(RelayProperties properties) {
        ServiceRegistry registry = new ServiceRegistry();

        properties.getServices().forEach((serviceName, instances) -> {
            for (int i = 0; i < instances.size(); i++) {
                RelayProperties.InstanceDefinition def = instances.get(i);
                String id = def.getId() != null ? def.getId() : serviceName + "-" + (i + 1);
                registry.register(serviceName, id, def.getUrl(), def.getWeight());
            }
        });

        log.info("Initialized service registry with {} services", registry.getServiceNames().size());
        return registry;
    }

    @Bean
    public RouteTable routeTable(RelayProperties properties) {
        List<RouteEntry> entries = properties.getRoutes().stream()
                .map(RelayProperties.RouteDefinition::toEntry)
                .toList();
        return new RouteTable(entries);
    }

    @Bean
    public EndpointRateLimiterRegistry endpointRateLimiterRegistry(RelayProperties properties, RouteTable routeTable) {
        RelayProperties.RateLimit config = properties.getRateLimit();
        EndpointRateLimiterRegistry registry = new EndpointRateLimiterRegistry(
                config.getRatePerMinute(), config.getBurst(),
                config.getCleanupInterval(), Clock.systemUTC(), config.isSweepEnabled());

        for (RelayProperties.EndpointLimit endpoint : config.getEndpoints()) {
            registry.addEndpoint(endpoint.getPrefix(), endpoint.getRatePerMinute(), endpoint.getBurst());
        }
        for (RouteEntry route : routeTable.getRoutes()) {
            if (route.hasRateLimit()) {
                registry.addEndpoint(route.getPathPrefix(),
                        route.getRateLimit().ratePerMinute(), route.getRateLimit().burst());
            }
        }

        log.info("Default rate limit: {}/min, burst {}", config.getRatePerMinute(), config.getBurst());
        return registry;
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(RelayProperties properties,
                                                         ObjectProvider<CircuitStateListener> listeners) {
        RelayProperties.Breaker config = properties.getCircuitBreaker();

        Map<String, CircuitBreakerSettings> overrides = new LinkedHashMap<>();
        config.getServices().forEach((serviceName, override) -> overrides.put(serviceName, override.toSettings()));

        List<CircuitStateListener> registered = listeners.orderedStream().toList();
        CircuitStateListener listener = (serviceName, from, to) ->
                registered.forEach(l -> l.onStateChange(serviceName, from, to));

        return new CircuitBreakerRegistry(config.toSettings(), overrides, listener, Clock.systemUTC());
    }

    @Bean
    public BackendClient backendClient(RelayProperties properties) {
        RelayProperties.Dispatch dispatch = properties.getDispatch();
        return new BackendClient(dispatch.getConnectTimeout(), dispatch.getRequestTimeout());
    }

    @Bean
    public ResilientDispatcher resilientDispatcher(RelayProperties properties,
                                                   ServiceRegistry serviceRegistry,
                                                   ObjectProvider<ResponseCache> responseCache,
                                                   CircuitBreakerRegistry circuitBreakerRegistry,
                                                   BackendClient backendClient) {
        return new ResilientDispatcher(
                serviceRegistry,
                responseCache.getIfAvailable(),
                circuitBreakerRegistry,
                new RetryExecutor(),
                properties.getRetry().toPolicy(),
                properties.getRetry().getRetryableStatuses(),
                backendClient,
                properties.getCache().getTtl());
    }
}
