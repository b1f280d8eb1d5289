package com.psl.search.resilience;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.resilience")
public class ResilienceProperties {
    private int providerFailureThreshold = 3;
    private long providerOpenMs = 60000;
    private int embedFailureThreshold = 3;
    private long embedOpenMs = 30000;

    public int getProviderFailureThreshold() {
        return providerFailureThreshold;
    }

    public void setProviderFailureThreshold(int providerFailureThreshold) {
        this.providerFailureThreshold = providerFailureThreshold;
    }

    public long getProviderOpenMs() {
        return providerOpenMs;
    }

    public void setProviderOpenMs(long providerOpenMs) {
        this.providerOpenMs = providerOpenMs;
    }

    public int getEmbedFailureThreshold() {
        return embedFailureThreshold;
    }

    public void setEmbedFailureThreshold(int embedFailureThreshold) {
        this.embedFailureThreshold = embedFailureThreshold;
    }

    public long getEmbedOpenMs() {
        return embedOpenMs;
    }

    public void setEmbedOpenMs(long embedOpenMs) {
        this.embedOpenMs = embedOpenMs;
    }
}
