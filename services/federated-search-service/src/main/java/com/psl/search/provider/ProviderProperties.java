package com.psl.search.provider;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.providers")
public class ProviderProperties {
    private int connectTimeoutMs = 5000;
    private int readTimeoutMs = 15000;
    private long rateLimitWaitMs = 2000;
    private String userAgent = "psl-federated-search/0.1";
    private String mailto;
    private Map<String, Source> sources = new LinkedHashMap<>();

    public Source source(String providerId) {
        return sources.computeIfAbsent(providerId, id -> new Source());
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }

    public long getRateLimitWaitMs() {
        return rateLimitWaitMs;
    }

    public void setRateLimitWaitMs(long rateLimitWaitMs) {
        this.rateLimitWaitMs = rateLimitWaitMs;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public String getMailto() {
        return mailto;
    }

    public void setMailto(String mailto) {
        this.mailto = mailto;
    }

    public Map<String, Source> getSources() {
        return sources;
    }

    public void setSources(Map<String, Source> sources) {
        this.sources = sources;
    }

    public static class Source {
        private boolean enabled = true;
        private String baseUrl;
        private Integer ratePerMinute;
        private Integer burst;
        private String apiKey;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Integer getRatePerMinute() {
            return ratePerMinute;
        }

        public void setRatePerMinute(Integer ratePerMinute) {
            this.ratePerMinute = ratePerMinute;
        }

        public Integer getBurst() {
            return burst;
        }

        public void setBurst(Integer burst) {
            this.burst = burst;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }
    }
}
