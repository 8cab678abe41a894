package com.relay.proxy;

import com.relay.cache.ResponseCache;
import com.relay.control.CircuitBreaker;
import com.relay.control.CircuitBreakerRegistry;
import com.relay.control.Deadline;
import com.relay.control.RetryExecutor;
import com.relay.control.RetryPolicy;
import com.relay.exception.BackendStatusException;
import com.relay.exception.CircuitBreakerRejectedException;
import com.relay.exception.DispatchFailedException;
import com.relay.exception.RetryCancelledException;
import com.relay.exception.ServiceNotFoundException;
import com.relay.exception.TransportException;
import com.relay.model.CachedResponse;
import com.relay.model.DispatchRequest;
import com.relay.model.DispatchResponse;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

@Slf4j
public class ResilientDispatcher {

    public static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(5);

    static final Predicate<Throwable> RETRYABLE_FAILURES = RetryPolicy.retryOn(
            ServiceNotFoundException.class,
            TransportException.class,
            BackendStatusException.class);

    private final ServiceLocator serviceLocator;
    private final ResponseCache responseCache;
    private final CircuitBreakerRegistry circuitBreakers;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy retryPolicy;
    private final Set<Integer> retryableStatuses;
    private final BackendClient backendClient;
    private final Duration cacheTtl;

    public ResilientDispatcher(ServiceLocator serviceLocator,
                               ResponseCache responseCache,
                               CircuitBreakerRegistry circuitBreakers,
                               RetryExecutor retryExecutor,
                               RetryPolicy retryPolicy,
                               Set<Integer> retryableStatuses,
                               BackendClient backendClient,
                               Duration cacheTtl) {
        this.serviceLocator = serviceLocator;
        this.responseCache = responseCache;
        this.circuitBreakers = circuitBreakers;
        this.retryExecutor = retryExecutor;
        this.retryPolicy = retryPolicy.getRetryable() != null
                ? retryPolicy
                : retryPolicy.toBuilder().retryable(RETRYABLE_FAILURES).build();
        this.retryableStatuses = Set.copyOf(retryableStatuses);
        this.backendClient = backendClient;
        this.cacheTtl = cacheTtl != null ? cacheTtl : DEFAULT_CACHE_TTL;
    }

    public DispatchResponse dispatch(String serviceName, DispatchRequest request, Deadline deadline) {
        boolean cacheable = request.isCacheEligible() && responseCache != null;
        String cacheKey = cacheKey(serviceName, request);

        if (cacheable) {
            Optional<CachedResponse> cached = lookup(cacheKey);
            if (cached.isPresent()) {
                log.debug("Cache hit for {}", cacheKey);
                return DispatchResponse.fromCache(cached.get());
            }
        }

        CircuitBreaker breaker = circuitBreakers.get(serviceName);

        DispatchResponse response;
        try {
            response = breaker.execute(() ->
                    retryExecutor.call(deadline, retryPolicy, () -> attempt(serviceName, request, deadline)));

        } catch (CircuitBreakerRejectedException e) {
            log.warn("Circuit breaker rejected request to {}: {}", serviceName, e.getMessage());
            throw e;

        } catch (RetryCancelledException e) {
            log.warn("Dispatch to {} cancelled: {}", serviceName, e.getMessage());
            throw e;

        } catch (Exception e) {
            log.error("Error proxying request to {}: {}", serviceName, e.getMessage());
            throw new DispatchFailedException(serviceName, e);
        }

        if (cacheable && response.getStatusCode() == 200) {
            store(cacheKey, response.toCached());
        }

        return response;
    }

    private DispatchResponse attempt(String serviceName, DispatchRequest request, Deadline deadline) {
        String address = serviceLocator.resolveHealthy(serviceName);

        log.debug("Routing {} {} to {} at {}", request.getMethod(), request.getPath(), serviceName, address);
        DispatchResponse response = backendClient.send(address, request, deadline);

        if (retryableStatuses.contains(response.getStatusCode())) {
            throw new BackendStatusException(response.getStatusCode());
        }
        return response;
    }

    private Optional<CachedResponse> lookup(String cacheKey) {
        try {
            return responseCache.get(cacheKey);
        } catch (RuntimeException e) {
            log.warn("Cache lookup failed for {}: {}", cacheKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void store(String cacheKey, CachedResponse response) {
        try {
            responseCache.put(cacheKey, response, cacheTtl);
        } catch (RuntimeException e) {
            log.warn("Failed to cache response: {}", e.getMessage());
        }
    }

    static String cacheKey(String serviceName, DispatchRequest request) {
        return serviceName + ":" + request.pathWithQuery();
    }
}
