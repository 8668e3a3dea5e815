package com.liquidation.heatmap.domain.model;

import java.math.BigDecimal;
import java.util.List;

public record SupportResistance(
        String symbol,
        ClusterMode mode,
        BigDecimal currentPrice,
        List<Cluster> support,
        List<Cluster> resistance,
        long timestamp
) {
}
