package com.liquidation.heatmap.domain.service;

import com.liquidation.heatmap.domain.model.ClusterGeneration;
import com.liquidation.heatmap.domain.model.ClusterMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Component
public class ClusterStore {

    private final Map<StoreKey, ClusterGeneration> latestGenerations = new ConcurrentHashMap<>();
    private final Map<StoreKey, AtomicLong> generationCounters = new ConcurrentHashMap<>();

    public long nextGeneration(String symbol, ClusterMode mode) {
        return generationCounters
                .computeIfAbsent(StoreKey.of(symbol, mode), k -> new AtomicLong())
                .incrementAndGet();
    }

    public void publish(ClusterGeneration generation) {
        StoreKey key = StoreKey.of(generation.symbol(), generation.mode());
        ClusterGeneration stored = latestGenerations.merge(key, generation,
                (existing, candidate) -> candidate.generation() > existing.generation() ? candidate : existing);

        if (stored != generation) {
            log.warn("[ClusterStore] 이전 세대 publish 무시: symbol={}, mode={}, gen={} (보유 gen={})",
                    generation.symbol(), generation.mode(), generation.generation(), stored.generation());
            return;
        }
        log.debug("[ClusterStore] publish: symbol={}, mode={}, gen={}, clusters={}, stale={}",
                generation.symbol(), generation.mode(), generation.generation(),
                generation.clusters().size(), generation.stale());
    }

    public Optional<ClusterGeneration> getLatest(String symbol, ClusterMode mode) {
        if (symbol == null || mode == null) return Optional.empty();
        return Optional.ofNullable(latestGenerations.get(StoreKey.of(symbol, mode)));
    }

    public long getAgeMs(String symbol, ClusterMode mode, long nowMs) {
        return getLatest(symbol, mode)
                .map(g -> Math.max(0L, nowMs - g.timestamp()))
                .orElse(Long.MAX_VALUE);
    }

    public Collection<ClusterGeneration> getAll() {
        return Collections.unmodifiableCollection(latestGenerations.values());
    }

    private record StoreKey(String symbol, ClusterMode mode) {
        static StoreKey of(String symbol, ClusterMode mode) {
            return new StoreKey(symbol.toUpperCase(), mode);
        }
    }
}
