package com.liquidation.heatmap.domain.model;

import java.math.BigDecimal;

public record LiquidationLevel(
        String symbol,
        BigDecimal price,
        PositionSide side,
        LevelSource source,
        double notional,
        double weight,
        long timestamp
) {

    public LiquidationLevel {
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("price must be positive");
        }
        if (side == null || source == null) {
            throw new IllegalArgumentException("side and source are required");
        }
        if (notional < 0 || weight < 0) {
            throw new IllegalArgumentException("notional and weight must be non-negative");
        }
    }
}
