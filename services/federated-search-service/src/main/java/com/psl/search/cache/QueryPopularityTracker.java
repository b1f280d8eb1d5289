package com.psl.search.cache;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Rolling request counter per normalized query, kept in the same backend as the result cache.
 */
@Component
public class QueryPopularityTracker {
    private static final Logger logger = LoggerFactory.getLogger(QueryPopularityTracker.class);

    private final CacheBackend backend;
    private final CacheProperties properties;

    public QueryPopularityTracker(@Qualifier("resultCacheBackend") CacheBackend backend, CacheProperties properties) {
        this.backend = backend;
        this.properties = properties;
    }

    /**
     * Counts one request and returns the count inside the current window; 0 when the backend fails.
     */
    public long record(String query) {
        CacheProperties.Result result = properties.getResult();
        String key = result.getPopularityPrefix() + CacheKeyUtil.sha256(CacheKeyUtil.normalizeQuery(query));
        try {
            return backend.increment(key, Duration.ofSeconds(result.getPopularityWindowSeconds()));
        } catch (RuntimeException e) {
            logger.warn("popularity_record_failed backend={} error={}", backend.name(), e.getMessage());
            return 0L;
        }
    }
}
