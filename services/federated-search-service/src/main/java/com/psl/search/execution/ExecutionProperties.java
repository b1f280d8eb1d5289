package com.psl.search.execution;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.execution")
public class ExecutionProperties {
    private int poolSize = 12;
    private long deadlineMs = 30000;
    private int minPerProviderLimit = 20;
    private int fallbackMinProviders = 3;

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    public long getDeadlineMs() {
        return deadlineMs;
    }

    public void setDeadlineMs(long deadlineMs) {
        this.deadlineMs = deadlineMs;
    }

    public int getMinPerProviderLimit() {
        return minPerProviderLimit;
    }

    public void setMinPerProviderLimit(int minPerProviderLimit) {
        this.minPerProviderLimit = minPerProviderLimit;
    }

    public int getFallbackMinProviders() {
        return fallbackMinProviders;
    }

    public void setFallbackMinProviders(int fallbackMinProviders) {
        this.fallbackMinProviders = fallbackMinProviders;
    }
}
