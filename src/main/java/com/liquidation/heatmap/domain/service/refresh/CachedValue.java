package com.liquidation.heatmap.domain.service.refresh;

public record CachedValue<T>(T value, long fetchedAt, boolean stale, boolean refreshFailed) {

    public long ageMs(long nowMs) {
        return Math.max(0L, nowMs - fetchedAt);
    }
}
