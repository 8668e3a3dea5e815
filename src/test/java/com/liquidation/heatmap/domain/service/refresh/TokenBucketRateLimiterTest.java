package com.liquidation.heatmap.domain.service.refresh;

import com.liquidation.heatmap.domain.exception.MarketDataException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class TokenBucketRateLimiterTest {

    private final AtomicLong ticker = new AtomicLong(0);
    private final List<Long> sleeps = new ArrayList<>();

    @Test
    @DisplayName("burst is granted immediately, then callers queue behind the refill rate")
    void burstThenQueue() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(10, 2, ticker::get, sleeps::add);

        assertEquals(0L, limiter.acquire());
        assertEquals(0L, limiter.acquire());
        assertEquals(100, TimeUnit.NANOSECONDS.toMillis(limiter.acquire()));
        assertEquals(200, TimeUnit.NANOSECONDS.toMillis(limiter.acquire()));
        assertEquals(2, sleeps.size());
    }

    @Test
    @DisplayName("permits refill over time up to the burst size")
    void refill() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(10, 2, ticker::get, sleeps::add);
        limiter.acquire();
        limiter.acquire();

        ticker.addAndGet(TimeUnit.MILLISECONDS.toNanos(100));
        assertEquals(1.0, limiter.availablePermits(), 1e-9);

        ticker.addAndGet(TimeUnit.SECONDS.toNanos(10));
        assertEquals(2.0, limiter.availablePermits(), 1e-9);
        assertEquals(0L, limiter.acquire());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("interruption while waiting surfaces as MarketDataException with the flag restored")
    void interrupted() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(1, 1, ticker::get, nanos -> {
            throw new InterruptedException("test");
        });
        limiter.acquire();

        assertThrows(MarketDataException.class, limiter::acquire);
        assertTrue(Thread.interrupted());
    }

    @Test
    @DisplayName("non-positive rate or burst is rejected")
    void invalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new TokenBucketRateLimiter(0, 1));
        assertThrows(IllegalArgumentException.class, () -> new TokenBucketRateLimiter(1, 0));
    }
}
