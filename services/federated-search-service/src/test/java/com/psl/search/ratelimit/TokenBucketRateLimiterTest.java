package com.psl.search.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class TokenBucketRateLimiterTest {

    @Test
    void burstIsAvailableImmediately() throws InterruptedException {
        AtomicLong clock = new AtomicLong(0L);
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(60, 3, clock::get);

        assertTrue(limiter.tryAcquire(0));
        assertTrue(limiter.tryAcquire(0));
        assertTrue(limiter.tryAcquire(0));
        assertFalse(limiter.tryAcquire(0));
    }

    @Test
    void refillsAtConfiguredRate() throws InterruptedException {
        AtomicLong clock = new AtomicLong(0L);
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(60, 1, clock::get);

        assertTrue(limiter.tryAcquire(0));
        assertFalse(limiter.tryAcquire(0));

        clock.addAndGet(TimeUnit.MILLISECONDS.toNanos(1000));
        assertTrue(limiter.tryAcquire(0));
    }

    @Test
    void neverRefillsBeyondBurst() {
        AtomicLong clock = new AtomicLong(0L);
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(600, 2, clock::get);

        clock.addAndGet(TimeUnit.MINUTES.toNanos(10));

        assertEquals(2.0, limiter.availableTokens(), 1e-9);
    }

    @Test
    void rejectsWhenWaitExceedsBudget() throws InterruptedException {
        AtomicLong clock = new AtomicLong(0L);
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(1, 1, clock::get);

        assertTrue(limiter.tryAcquire(0));
        assertFalse(limiter.tryAcquire(100));
        assertEquals(0.0, limiter.availableTokens(), 1e-9);
    }

    @Test
    void waitsForShortRefill() throws InterruptedException {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(6000, 1);

        assertTrue(limiter.tryAcquire(0));
        long started = System.nanoTime();
        assertTrue(limiter.tryAcquire(1000));
        long waitedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertTrue(waitedMs < 1000, "waited " + waitedMs + "ms");
    }
}
