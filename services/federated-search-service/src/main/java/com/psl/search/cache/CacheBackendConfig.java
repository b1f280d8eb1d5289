package com.psl.search.cache;

import com.psl.search.embed.EmbeddingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Picks the shared Redis store when configured and reachable through a template, otherwise an in-process map.
 */
@Configuration
public class CacheBackendConfig {
    private static final Logger logger = LoggerFactory.getLogger(CacheBackendConfig.class);

    @Bean
    public CacheBackend resultCacheBackend(ObjectProvider<StringRedisTemplate> redisTemplate, CacheProperties properties) {
        CacheBackend backend = select(redisTemplate, properties.getBackend(), properties.getMaxEntries());
        logger.info("cache_backend_selected cache=result backend={}", backend.name());
        return backend;
    }

    @Bean
    public CacheBackend embeddingCacheBackend(
        ObjectProvider<StringRedisTemplate> redisTemplate,
        CacheProperties properties,
        EmbeddingProperties embeddingProperties
    ) {
        CacheBackend backend = select(
            redisTemplate,
            properties.getBackend(),
            embeddingProperties.getCache().getMaxEntries()
        );
        logger.info("cache_backend_selected cache=embedding backend={}", backend.name());
        return backend;
    }

    static CacheBackend select(ObjectProvider<StringRedisTemplate> redisTemplate, String backend, int maxEntries) {
        String requested = backend == null ? "" : backend.trim();
        if ("redis".equalsIgnoreCase(requested)) {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template != null) {
                return new RedisCacheBackend(template);
            }
            logger.warn("cache_backend_fallback requested=redis reason=no_redis_template");
            return new InMemoryCacheBackend(maxEntries);
        }
        if ("none".equalsIgnoreCase(requested)) {
            return new DisabledCacheBackend();
        }
        return new InMemoryCacheBackend(maxEntries);
    }
}
