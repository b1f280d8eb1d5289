package com.psl.search.embed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.psl.search.cache.CacheBackend;
import com.psl.search.cache.CacheKeyUtil;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Text hash to vector. Keys are derived from the exact text, so entries never need updating.
 */
@Service
public class EmbeddingCacheService {
    private static final Logger logger = LoggerFactory.getLogger(EmbeddingCacheService.class);
    private static final TypeReference<List<Double>> VECTOR = new TypeReference<>() {
    };

    private final CacheBackend backend;
    private final EmbeddingProperties properties;
    private final ObjectMapper objectMapper;

    public EmbeddingCacheService(
        @Qualifier("embeddingCacheBackend") CacheBackend backend,
        EmbeddingProperties properties,
        ObjectMapper objectMapper
    ) {
        this.backend = backend;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public Optional<List<Double>> get(String text) {
        String key = buildKey(text);
        if (key == null) {
            return Optional.empty();
        }
        try {
            Optional<String> cached = backend.get(key);
            if (cached.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(cached.get(), VECTOR));
        } catch (JsonProcessingException e) {
            logger.warn("embedding_cache_corrupt key={}", key);
            return Optional.empty();
        } catch (RuntimeException e) {
            logger.warn("embedding_cache_read_failed backend={} error={}", backend.name(), e.getMessage());
            return Optional.empty();
        }
    }

    public void put(String text, List<Double> vector) {
        String key = buildKey(text);
        if (key == null || vector == null || vector.isEmpty()) {
            return;
        }
        try {
            backend.set(key, objectMapper.writeValueAsString(vector), Duration.ofMillis(properties.getCache().getTtlMs()));
        } catch (JsonProcessingException e) {
            logger.warn("embedding_cache_serialize_failed key={}", key);
        } catch (RuntimeException e) {
            logger.warn("embedding_cache_write_failed backend={} error={}", backend.name(), e.getMessage());
        }
    }

    public boolean isEnabled() {
        return properties.getCache() != null && properties.getCache().isEnabled();
    }

    String buildKey(String text) {
        if (!isEnabled() || text == null || text.isBlank()) {
            return null;
        }
        int maxLen = properties.getCache().getMaxTextLength();
        if (maxLen > 0 && text.length() > maxLen) {
            return null;
        }
        String model = properties.getModel() == null ? "" : properties.getModel();
        return "embed:" + properties.getMode().name().toLowerCase(Locale.ROOT) + ":" + model + ":" + CacheKeyUtil.sha256(text);
    }
}
