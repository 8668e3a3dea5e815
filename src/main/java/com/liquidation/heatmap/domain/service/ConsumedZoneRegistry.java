package com.liquidation.heatmap.domain.service;

import com.liquidation.heatmap.domain.model.Cluster;
import com.liquidation.heatmap.domain.model.ClusterGeneration;
import com.liquidation.heatmap.domain.model.PositionSide;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers reactive cluster zones that price has already traded through.
 * A zone stays consumed until it ages out; clusters rebuilt from the same
 * (older) events in that zone are emitted inactive.
 */
@Slf4j
@Component
public class ConsumedZoneRegistry {

    private final Map<String, List<ConsumedZone>> zonesBySymbol = new ConcurrentHashMap<>();

    public Set<String> recordCrossings(ClusterGeneration previous, BigDecimal newPrice, long nowMs) {
        if (previous == null || previous.referencePrice() == null || newPrice == null) return Set.of();

        BigDecimal low = previous.referencePrice().min(newPrice);
        BigDecimal high = previous.referencePrice().max(newPrice);

        Set<String> crossed = new HashSet<>();
        List<ConsumedZone> newZones = new ArrayList<>();
        for (Cluster cluster : previous.clusters()) {
            if (!cluster.isActive()) continue;
            if (cluster.getPrice().compareTo(low) >= 0 && cluster.getPrice().compareTo(high) <= 0) {
                crossed.add(cluster.getId());
                newZones.add(new ConsumedZone(cluster.getPrice(), cluster.getSide(), nowMs));
            }
        }

        if (!newZones.isEmpty()) {
            zonesBySymbol.merge(previous.symbol(), List.copyOf(newZones), (existing, added) -> {
                List<ConsumedZone> merged = new ArrayList<>(existing);
                merged.addAll(added);
                return List.copyOf(merged);
            });
            log.info("[ConsumedZone] {} | 가격 {} → {} 구간에서 클러스터 {}개 소진: {}",
                    previous.symbol(), previous.referencePrice().toPlainString(), newPrice.toPlainString(),
                    crossed.size(), crossed);
        }
        return crossed;
    }

    public List<Cluster> applyTo(String symbol, List<Cluster> clusters, double bucketWidthPct) {
        List<ConsumedZone> zones = zonesBySymbol.getOrDefault(symbol, List.of());
        if (zones.isEmpty()) return clusters;

        List<Cluster> result = new ArrayList<>(clusters.size());
        for (Cluster cluster : clusters) {
            boolean consumed = zones.stream().anyMatch(zone -> zone.covers(cluster, bucketWidthPct));
            result.add(consumed ? cluster.deactivated() : cluster);
        }
        return result;
    }

    public void prune(String symbol, long nowMs, long retentionMs) {
        zonesBySymbol.computeIfPresent(symbol, (k, zones) -> {
            List<ConsumedZone> kept = zones.stream()
                    .filter(zone -> nowMs - zone.consumedAt() <= retentionMs)
                    .toList();
            return kept.isEmpty() ? null : kept;
        });
    }

    public int size(String symbol) {
        return zonesBySymbol.getOrDefault(symbol, List.of()).size();
    }

    record ConsumedZone(BigDecimal price, PositionSide side, long consumedAt) {

        boolean covers(Cluster cluster, double bucketWidthPct) {
            if (cluster.getSide() != side) return false;
            if (cluster.getLastUpdated() > consumedAt) return false;
            return ClusterBuilder.distancePercent(cluster.getPrice(), price) <= bucketWidthPct;
        }
    }
}
