package com.liquidation.heatmap.domain.model;

import java.math.BigDecimal;

public record PriceSnapshot(String symbol, BigDecimal price, long timestamp) implements Timestamped {

    public PriceSnapshot {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol must not be blank");
        }
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("price must be positive");
        }
        if (timestamp <= 0) {
            throw new IllegalArgumentException("timestamp must be positive");
        }
        symbol = symbol.toUpperCase();
    }
}
