package com.psl.search.resilience;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class CircuitBreakerTest {

    @Test
    void opensAfterThresholdAndRecoversAfterOpenDuration() {
        AtomicLong clock = new AtomicLong(1_000L);
        CircuitBreaker breaker = new CircuitBreaker(3, 500L, clock::get);

        breaker.recordFailure();
        breaker.recordFailure();
        assertTrue(breaker.allowRequest());
        assertEquals("closed", breaker.state());

        breaker.recordFailure();
        assertFalse(breaker.allowRequest());
        assertEquals("open", breaker.state());

        clock.addAndGet(499L);
        assertTrue(breaker.isOpen());

        clock.addAndGet(1L);
        assertTrue(breaker.allowRequest());
    }

    @Test
    void successResetsFailureCount() {
        AtomicLong clock = new AtomicLong(0L);
        CircuitBreaker breaker = new CircuitBreaker(2, 1_000L, clock::get);

        breaker.recordFailure();
        breaker.recordSuccess();
        breaker.recordFailure();

        assertTrue(breaker.allowRequest());
    }
}
