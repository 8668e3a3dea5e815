package com.liquidation.heatmap.domain.model;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public record ClusterGeneration(
        String symbol,
        ClusterMode mode,
        long generation,
        BigDecimal referencePrice,
        long timestamp,
        boolean stale,
        List<Cluster> clusters
) implements Timestamped {

    public ClusterGeneration {
        clusters = clusters == null ? List.of() : List.copyOf(clusters);
    }

    public long activeCount() {
        return clusters.stream().filter(Cluster::isActive).count();
    }

    public Optional<Cluster> best(double minStrength) {
        return clusters.stream()
                .filter(Cluster::isActive)
                .filter(c -> c.getStrength() >= minStrength)
                .min(Comparator.comparingDouble(Cluster::getStrength).reversed()
                        .thenComparingDouble(Cluster::getDistancePercent)
                        .thenComparing(Cluster::getPrice));
    }
}
