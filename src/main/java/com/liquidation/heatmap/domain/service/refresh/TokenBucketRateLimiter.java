package com.liquidation.heatmap.domain.service.refresh;

import com.liquidation.heatmap.domain.exception.MarketDataException;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Shared limiter for upstream calls. Callers reserve a permit under the lock and then
 * sleep outside it, so waiting callers queue up as permit debt instead of spinning.
 */
public class TokenBucketRateLimiter {

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    @FunctionalInterface
    interface Sleeper {
        void sleepNanos(long nanos) throws InterruptedException;
    }

    private final double permitsPerSecond;
    private final double maxPermits;
    private final LongSupplier nanoTicker;
    private final Sleeper sleeper;

    private double storedPermits;
    private long lastRefillNanos;

    public TokenBucketRateLimiter(double permitsPerSecond, int burst) {
        this(permitsPerSecond, burst, System::nanoTime, TimeUnit.NANOSECONDS::sleep);
    }

    TokenBucketRateLimiter(double permitsPerSecond, int burst, LongSupplier nanoTicker, Sleeper sleeper) {
        if (permitsPerSecond <= 0 || burst < 1) {
            throw new IllegalArgumentException("permitsPerSecond must be positive and burst >= 1");
        }
        this.permitsPerSecond = permitsPerSecond;
        this.maxPermits = burst;
        this.nanoTicker = nanoTicker;
        this.sleeper = sleeper;
        this.storedPermits = burst;
        this.lastRefillNanos = nanoTicker.getAsLong();
    }

    /**
     * Blocks until a permit is granted.
     *
     * @return nanoseconds spent waiting, 0 when a permit was immediately available
     */
    public long acquire() {
        long waitNanos = reserve();
        if (waitNanos > 0) {
            try {
                sleeper.sleepNanos(waitNanos);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new MarketDataException("interrupted while waiting for rate limit permit", e);
            }
        }
        return waitNanos;
    }

    synchronized long reserve() {
        refill(nanoTicker.getAsLong());
        storedPermits -= 1;
        if (storedPermits >= 0) return 0L;
        return (long) Math.ceil(-storedPermits / permitsPerSecond * NANOS_PER_SECOND);
    }

    public synchronized double availablePermits() {
        refill(nanoTicker.getAsLong());
        return storedPermits;
    }

    private void refill(long nowNanos) {
        long elapsed = nowNanos - lastRefillNanos;
        if (elapsed > 0) {
            storedPermits = Math.min(maxPermits, storedPermits + elapsed / NANOS_PER_SECOND * permitsPerSecond);
            lastRefillNanos = nowNanos;
        }
    }
}
