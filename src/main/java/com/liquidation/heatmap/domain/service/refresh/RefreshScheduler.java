package com.liquidation.heatmap.domain.service.refresh;

import com.liquidation.heatmap.domain.exception.DataUnavailableException;
import com.liquidation.heatmap.domain.exception.MarketDataException;
import com.liquidation.heatmap.domain.model.Timestamped;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Keyed cache of upstream snapshots and locally recomputed generations. Every
 * (symbol, kind) entry expires on its own schedule and is refreshed by at most one
 * caller at a time; other symbols and kinds are never blocked by it.
 */
@Slf4j
@Component
public class RefreshScheduler {

    private final Map<EntryKey, Entry<?>> entries = new ConcurrentHashMap<>();

    private final RefreshProperties properties;
    private final TokenBucketRateLimiter rateLimiter;
    private final ExecutorService upstreamCallExecutor;
    private final Clock clock;
    private final DoubleSupplier jitterSource;
    private final MeterRegistry meterRegistry;

    @Autowired
    public RefreshScheduler(
            RefreshProperties properties,
            TokenBucketRateLimiter rateLimiter,
            @Qualifier("upstreamCallExecutor") ExecutorService upstreamCallExecutor,
            Clock clock,
            MeterRegistry meterRegistry) {
        this(properties, rateLimiter, upstreamCallExecutor, clock,
                () -> ThreadLocalRandom.current().nextDouble(), meterRegistry);
    }

    RefreshScheduler(
            RefreshProperties properties,
            TokenBucketRateLimiter rateLimiter,
            ExecutorService upstreamCallExecutor,
            Clock clock,
            DoubleSupplier jitterSource,
            MeterRegistry meterRegistry) {
        this.properties = properties;
        this.rateLimiter = rateLimiter;
        this.upstreamCallExecutor = upstreamCallExecutor;
        this.clock = clock;
        this.jitterSource = jitterSource;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Returns the cached value when still valid, otherwise refreshes it with {@code loader}.
     * A failed refresh falls back to the last value with {@code refreshFailed} set. A loaded value
     * older than the cached one is discarded and the cached one stays valid for another TTL.
     *
     * @throws DataUnavailableException when the refresh fails and nothing was ever cached
     */
    public <T extends Timestamped> CachedValue<T> get(String symbol, DataKind kind, Supplier<T> loader) {
        Entry<T> entry = entry(symbol, kind);
        Snapshot<T> current = entry.snapshot;
        if (current != null && clock.millis() < current.validUntil()) {
            return current.toCachedValue(clock.millis(), properties.getStaleCeilingMs(), false);
        }

        entry.lock.lock();
        try {
            current = entry.snapshot;
            if (current != null && clock.millis() < current.validUntil()) {
                return current.toCachedValue(clock.millis(), properties.getStaleCeilingMs(), false);
            }
            return refreshLocked(symbol, kind, entry, loader);
        } finally {
            entry.lock.unlock();
        }
    }

    /**
     * Refreshes the entry regardless of its expiry. Used by the periodic recompute job.
     */
    public <T extends Timestamped> CachedValue<T> refresh(String symbol, DataKind kind, Supplier<T> loader) {
        Entry<T> entry = entry(symbol, kind);
        entry.lock.lock();
        try {
            return refreshLocked(symbol, kind, entry, loader);
        } finally {
            entry.lock.unlock();
        }
    }

    /**
     * Push path for streamed values. Values older than the cached one are rejected, as on the
     * pull path.
     *
     * @return true when the value replaced the cached one
     */
    public <T extends Timestamped> boolean offer(String symbol, DataKind kind, T value) {
        if (value == null) return false;
        Entry<T> entry = entry(symbol, kind);
        entry.lock.lock();
        try {
            Snapshot<T> current = entry.snapshot;
            if (current != null && value.timestamp() < current.value().timestamp()) {
                log.debug("[Refresh] {} {} 오래된 push 값 거부: offered={} cached={}",
                        symbol, kind, value.timestamp(), current.value().timestamp());
                return false;
            }
            entry.store(value, clock.millis(), properties.ttlFor(kind));
            return true;
        } finally {
            entry.lock.unlock();
        }
    }

    public int entryCount() {
        return entries.size();
    }

    private <T extends Timestamped> CachedValue<T> refreshLocked(
            String symbol, DataKind kind, Entry<T> entry, Supplier<T> loader) {
        try {
            T value = load(symbol, kind, loader);
            if (value == null) {
                throw new DataUnavailableException(kind + " loader returned nothing for " + symbol);
            }
            long now = clock.millis();
            Snapshot<T> current = entry.snapshot;
            if (current != null && value.timestamp() < current.value().timestamp()) {
                counter("heatmap.refresh.out_of_order", kind).increment();
                log.debug("[Refresh] {} {} 조회 값이 캐시보다 오래됨 → 기존 값 유지: fetched={} cached={}",
                        symbol, kind, value.timestamp(), current.value().timestamp());
                entry.extend(now, properties.ttlFor(kind));
            } else {
                entry.store(value, now, properties.ttlFor(kind));
            }
            return entry.snapshot.toCachedValue(now, properties.getStaleCeilingMs(), false);
        } catch (RuntimeException e) {
            counter("heatmap.refresh.failures", kind).increment();
            Snapshot<T> last = entry.snapshot;
            if (last == null) {
                log.warn("[Refresh] {} {} 갱신 실패, 캐시 없음: {}", symbol, kind, e.getMessage());
                throw new DataUnavailableException(kind + " unavailable for " + symbol, e);
            }
            long now = clock.millis();
            CachedValue<T> served = last.toCachedValue(now, properties.getStaleCeilingMs(), true);
            counter("heatmap.refresh.stale_serves", kind).increment();
            log.warn("[Refresh] {} {} 갱신 실패 → 이전 값 제공 (age={}ms, stale={}): {}",
                    symbol, kind, served.ageMs(now), served.stale(), e.getMessage());
            return served;
        }
    }

    private <T> T load(String symbol, DataKind kind, Supplier<T> loader) {
        if (!kind.isUpstream()) {
            return loader.get();
        }

        int attempts = 1 + properties.getMaxRetries();
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return callUpstream(symbol, kind, loader);
            } catch (RuntimeException e) {
                lastFailure = e;
                log.warn("[Refresh] {} {} 업스트림 호출 실패 (attempt {}/{}): {}",
                        symbol, kind, attempt, attempts, e.getMessage());
            }
        }
        throw lastFailure;
    }

    private <T> T callUpstream(String symbol, DataKind kind, Supplier<T> loader) {
        long waitedNanos = rateLimiter.acquire();
        if (waitedNanos > 0) {
            counter("heatmap.refresh.rate_limit_waits", kind).increment();
            log.debug("[Refresh] {} {} rate limit 대기 {}ms", symbol, kind, TimeUnit.NANOSECONDS.toMillis(waitedNanos));
        }
        counter("heatmap.refresh.upstream_calls", kind).increment();

        CompletableFuture<T> future = CompletableFuture.supplyAsync(loader, upstreamCallExecutor);
        try {
            return future.get(properties.getCallTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new MarketDataException(kind + " call timed out after " + properties.getCallTimeoutMs() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new MarketDataException(kind + " call failed for " + symbol, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MarketDataException("interrupted while fetching " + kind + " for " + symbol, e);
        }
    }

    @SuppressWarnings("unchecked")
    private <T extends Timestamped> Entry<T> entry(String symbol, DataKind kind) {
        EntryKey key = new EntryKey(symbol.toUpperCase(), kind);
        return (Entry<T>) entries.computeIfAbsent(key, k -> {
            long jitterMs = (long) (jitterSource.getAsDouble() * properties.getJitterFraction() * properties.ttlFor(kind));
            return new Entry<T>(jitterMs);
        });
    }

    private Counter counter(String name, DataKind kind) {
        return Counter.builder(name)
                .tag("kind", kind.name())
                .register(meterRegistry);
    }

    private record EntryKey(String symbol, DataKind kind) {
    }

    private record Snapshot<T>(T value, long fetchedAt, long validUntil) {

        CachedValue<T> toCachedValue(long nowMs, long staleCeilingMs, boolean refreshFailed) {
            return new CachedValue<>(value, fetchedAt, nowMs - fetchedAt > staleCeilingMs, refreshFailed);
        }
    }

    private static final class Entry<T> {

        private final ReentrantLock lock = new ReentrantLock();
        private final long jitterMs;
        private volatile Snapshot<T> snapshot;

        Entry(long jitterMs) {
            this.jitterMs = jitterMs;
        }

        void store(T value, long nowMs, long ttlMs) {
            snapshot = new Snapshot<>(value, nowMs, nowMs + ttlMs + jitterMs);
        }

        void extend(long nowMs, long ttlMs) {
            Snapshot<T> current = snapshot;
            snapshot = new Snapshot<>(current.value(), current.fetchedAt(), nowMs + ttlMs + jitterMs);
        }
    }
}
