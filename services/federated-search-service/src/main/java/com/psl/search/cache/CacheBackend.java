package com.psl.search.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Keyed string store with expiry shared by the result and embedding caches.
 * Implementations may throw on I/O failure; callers treat that as a miss.
 */
public interface CacheBackend {
    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    void delete(String key);

    long deleteByPrefix(String prefix);

    /**
     * Increments a counter, starting its expiry window when the counter is created.
     */
    long increment(String key, Duration ttl);

    String name();
}
