package com.psl.search.ratelimit;

public interface RateLimiter {
    /**
     * Takes one permit, waiting at most {@code maxWaitMs} for the bucket to refill.
     *
     * @return false when no permit became available in time
     */
    boolean tryAcquire(long maxWaitMs) throws InterruptedException;
}
