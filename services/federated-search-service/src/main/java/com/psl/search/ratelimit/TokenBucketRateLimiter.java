package com.psl.search.ratelimit;

import java.util.function.LongSupplier;

public class TokenBucketRateLimiter implements RateLimiter {
    private final double capacity;
    private final double tokensPerNano;
    private final LongSupplier nanoClock;
    private double tokens;
    private long lastRefillNanos;

    public TokenBucketRateLimiter(int permitsPerMinute, int burst) {
        this(permitsPerMinute, burst, System::nanoTime);
    }

    public TokenBucketRateLimiter(int permitsPerMinute, int burst, LongSupplier nanoClock) {
        this.capacity = Math.max(1, burst);
        this.tokensPerNano = Math.max(1, permitsPerMinute) / 60_000_000_000d;
        this.nanoClock = nanoClock;
        this.tokens = capacity;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    @Override
    public boolean tryAcquire(long maxWaitMs) throws InterruptedException {
        long waitNanos;
        synchronized (this) {
            refill();
            if (tokens >= 1d) {
                tokens -= 1d;
                return true;
            }
            waitNanos = (long) Math.ceil((1d - tokens) / tokensPerNano);
            if (waitNanos > maxWaitMs * 1_000_000L) {
                return false;
            }
            // reserve the permit now so concurrent callers queue behind it
            tokens -= 1d;
        }
        Thread.sleep(waitNanos / 1_000_000L, (int) (waitNanos % 1_000_000L));
        return true;
    }

    synchronized double availableTokens() {
        refill();
        return tokens;
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + elapsed * tokensPerNano);
            lastRefillNanos = now;
        }
    }
}
