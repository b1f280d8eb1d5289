package com.psl.search.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.cache")
public class CacheProperties {
    private String backend = "memory";
    private int maxEntries = 5000;
    private Result result = new Result();

    public String getBackend() {
        return backend;
    }

    public void setBackend(String backend) {
        this.backend = backend;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public void setMaxEntries(int maxEntries) {
        this.maxEntries = maxEntries;
    }

    public Result getResult() {
        return result;
    }

    public void setResult(Result result) {
        this.result = result;
    }

    public static class Result {
        private boolean enabled = true;
        private String keyPrefix = "serp:";
        private String popularityPrefix = "popularity:";
        private long popularityWindowSeconds = 30L * 24 * 3600;
        private long popularThreshold = 100;
        private long warmThreshold = 10;
        private long popularTtlSeconds = 3600;
        private long warmTtlSeconds = 600;
        private long defaultTtlSeconds = 300;
        private boolean cacheEmpty = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public String getPopularityPrefix() {
            return popularityPrefix;
        }

        public void setPopularityPrefix(String popularityPrefix) {
            this.popularityPrefix = popularityPrefix;
        }

        public long getPopularityWindowSeconds() {
            return popularityWindowSeconds;
        }

        public void setPopularityWindowSeconds(long popularityWindowSeconds) {
            this.popularityWindowSeconds = popularityWindowSeconds;
        }

        public long getPopularThreshold() {
            return popularThreshold;
        }

        public void setPopularThreshold(long popularThreshold) {
            this.popularThreshold = popularThreshold;
        }

        public long getWarmThreshold() {
            return warmThreshold;
        }

        public void setWarmThreshold(long warmThreshold) {
            this.warmThreshold = warmThreshold;
        }

        public long getPopularTtlSeconds() {
            return popularTtlSeconds;
        }

        public void setPopularTtlSeconds(long popularTtlSeconds) {
            this.popularTtlSeconds = popularTtlSeconds;
        }

        public long getWarmTtlSeconds() {
            return warmTtlSeconds;
        }

        public void setWarmTtlSeconds(long warmTtlSeconds) {
            this.warmTtlSeconds = warmTtlSeconds;
        }

        public long getDefaultTtlSeconds() {
            return defaultTtlSeconds;
        }

        public void setDefaultTtlSeconds(long defaultTtlSeconds) {
            this.defaultTtlSeconds = defaultTtlSeconds;
        }

        public boolean isCacheEmpty() {
            return cacheEmpty;
        }

        public void setCacheEmpty(boolean cacheEmpty) {
            this.cacheEmpty = cacheEmpty;
        }
    }
}
