package com.relay.cache;

import com.relay.model.CachedResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class InMemoryResponseCache implements ResponseCache {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryResponseCache() {
        this(Clock.systemUTC());
    }

    public InMemoryResponseCache(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<CachedResponse> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.response());
    }

    @Override
    public void put(String key, CachedResponse response, Duration ttl) {
        entries.put(key, new Entry(response, clock.instant().plus(ttl)));
    }

    @Scheduled(fixedDelayString = "${relay.cache.purge-interval-ms:60000}")
    public void purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        int purged = before - entries.size();
        if (purged > 0) {
            log.debug("Purged {} expired cache entries", purged);
        }
    }

    public int size() {
        return entries.size();
    }

    private record Entry(CachedResponse response, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
