package com.relay.cache;

import com.relay.model.CachedResponse;

import java.time.Duration;
import java.util.Optional;

/** Implementations must be safe for concurrent use. */
public interface ResponseCache {

    Optional<CachedResponse> get(String key);

    void put(String key, CachedResponse response, Duration ttl);
}
