package com.jreinhal.docqa.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SimpleCircuitBreakerTest {

    private final AtomicLong now = new AtomicLong(1_000L);
    private SimpleCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        this.breaker = new SimpleCircuitBreaker("test", 2, Duration.ofSeconds(10), 1, this.now::get);
    }

    @Test
    void opensAfterThreshold() {
        breaker.recordFailure(new RuntimeException("first"));
        assertEquals(SimpleCircuitBreaker.State.CLOSED, breaker.getState());
        assertTrue(breaker.allowRequest());

        breaker.recordFailure(new RuntimeException("second"));

        assertEquals(SimpleCircuitBreaker.State.OPEN, breaker.getState());
        assertFalse(breaker.allowRequest());
        assertEquals(10_000L, breaker.remainingOpenMillis());
    }

    @Test
    void successResetsFailureCount() {
        breaker.recordFailure(new RuntimeException("first"));
        breaker.recordSuccess();
        breaker.recordFailure(new RuntimeException("second"));

        assertEquals(SimpleCircuitBreaker.State.CLOSED, breaker.getState());
    }

    @Test
    void halfOpenAllowsLimitedTrialCalls() {
        breaker.recordFailure(null);
        breaker.recordFailure(null);
        now.addAndGet(10_000L);

        assertTrue(breaker.allowRequest());
        assertEquals(SimpleCircuitBreaker.State.HALF_OPEN, breaker.getState());
        assertFalse(breaker.allowRequest());
    }

    @Test
    void halfOpenSuccessCloses() {
        breaker.recordFailure(null);
        breaker.recordFailure(null);
        now.addAndGet(10_000L);
        breaker.allowRequest();

        breaker.recordSuccess();

        assertEquals(SimpleCircuitBreaker.State.CLOSED, breaker.getState());
        assertTrue(breaker.allowRequest());
        assertEquals(0L, breaker.remainingOpenMillis());
    }

    @Test
    void halfOpenFailureReopens() {
        breaker.recordFailure(null);
        breaker.recordFailure(null);
        now.addAndGet(10_000L);
        breaker.allowRequest();

        breaker.recordFailure(new RuntimeException("still down"));

        assertEquals(SimpleCircuitBreaker.State.OPEN, breaker.getState());
        assertFalse(breaker.allowRequest());
    }
}
