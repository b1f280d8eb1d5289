package com.psl.search.cache;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.psl.search.api.dto.AggregateSearchResponse;
import com.psl.search.routing.SearchMode;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Ranked responses keyed by {@code serp:{category}:{mode}:{sha256(normalized query)}}. Entries are never
 * served past their TTL, and backend failures read as misses.
 */
@Service
public class ResultCacheService {
    private static final Logger logger = LoggerFactory.getLogger(ResultCacheService.class);

    private final CacheBackend backend;
    private final CacheProperties properties;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    public ResultCacheService(
        @Qualifier("resultCacheBackend") CacheBackend backend,
        CacheProperties properties,
        ObjectMapper objectMapper,
        MeterRegistry meterRegistry
    ) {
        this.backend = backend;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    public boolean isEnabled() {
        return properties.getResult().isEnabled();
    }

    public Optional<CachedResponse> get(String query, String category, SearchMode mode) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        String key = buildKey(query, category, mode);
        try {
            Optional<String> raw = backend.get(key);
            if (raw.isEmpty()) {
                count("miss");
                return Optional.empty();
            }
            CachedResponse cached = objectMapper.readValue(raw.get(), CachedResponse.class);
            count("hit");
            return Optional.of(cached);
        } catch (JsonProcessingException e) {
            logger.warn("result_cache_corrupt key={}", key);
            count("error");
            return Optional.empty();
        } catch (RuntimeException e) {
            logger.warn("result_cache_read_failed backend={} error={}", backend.name(), e.getMessage());
            count("error");
            return Optional.empty();
        }
    }

    public void put(String query, String category, SearchMode mode, AggregateSearchResponse response, Duration ttl) {
        if (!isEnabled() || response == null) {
            return;
        }
        boolean empty = response.getPapers() == null || response.getPapers().isEmpty();
        if (empty && !properties.getResult().isCacheEmpty()) {
            return;
        }
        String key = buildKey(query, category, mode);
        try {
            CachedResponse envelope = new CachedResponse(response, System.currentTimeMillis());
            backend.set(key, objectMapper.writeValueAsString(envelope), ttl);
        } catch (JsonProcessingException e) {
            logger.warn("result_cache_serialize_failed key={}", key);
        } catch (RuntimeException e) {
            logger.warn("result_cache_write_failed backend={} error={}", backend.name(), e.getMessage());
        }
    }

    /**
     * Popular queries stay cached longer: above the popular threshold 1 h, above the warm threshold 10 min,
     * otherwise the default 5 min.
     */
    public Duration resolveTtl(long popularity) {
        CacheProperties.Result result = properties.getResult();
        if (popularity > result.getPopularThreshold()) {
            return Duration.ofSeconds(result.getPopularTtlSeconds());
        }
        if (popularity > result.getWarmThreshold()) {
            return Duration.ofSeconds(result.getWarmTtlSeconds());
        }
        return Duration.ofSeconds(result.getDefaultTtlSeconds());
    }

    public long invalidateCategory(String category) {
        String prefix = categoryPrefix(category);
        try {
            long deleted = backend.deleteByPrefix(prefix);
            logger.info("result_cache_invalidated category={} deleted={}", category, deleted);
            return deleted;
        } catch (RuntimeException e) {
            logger.warn("result_cache_invalidate_failed category={} error={}", category, e.getMessage());
            return 0L;
        }
    }

    public String buildKey(String query, String category, SearchMode mode) {
        return categoryPrefix(category) + mode.value() + ":" + CacheKeyUtil.sha256(CacheKeyUtil.normalizeQuery(query));
    }

    private String categoryPrefix(String category) {
        return properties.getResult().getKeyPrefix() + category + ":";
    }

    private void count(String result) {
        meterRegistry.counter("search.cache.result.requests.total", "result", result).increment();
    }

    public static class CachedResponse {
        private AggregateSearchResponse response;

        @JsonProperty("created_at")
        private long createdAt;

        public CachedResponse() {
        }

        public CachedResponse(AggregateSearchResponse response, long createdAt) {
            this.response = response;
            this.createdAt = createdAt;
        }

        public AggregateSearchResponse getResponse() {
            return response;
        }

        public void setResponse(AggregateSearchResponse response) {
            this.response = response;
        }

        public long getCreatedAt() {
            return createdAt;
        }

        public void setCreatedAt(long createdAt) {
            this.createdAt = createdAt;
        }
    }
}
