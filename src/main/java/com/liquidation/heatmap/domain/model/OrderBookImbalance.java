package com.liquidation.heatmap.domain.model;

import java.math.BigDecimal;

/**
 * Bid and ask notional of the top of the order book, used to split open interest between
 * longs (bid side) and shorts (ask side).
 */
public record OrderBookImbalance(
        String symbol,
        BigDecimal bidNotional,
        BigDecimal askNotional,
        long timestamp
) implements Timestamped {

    public OrderBookImbalance {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol must not be blank");
        }
        if (bidNotional == null || bidNotional.signum() < 0 || askNotional == null || askNotional.signum() < 0) {
            throw new IllegalArgumentException("book notional must be non-negative");
        }
        symbol = symbol.toUpperCase();
    }

    public boolean isEmpty() {
        return bidNotional.signum() == 0 && askNotional.signum() == 0;
    }
}
