package com.liquidation.heatmap.domain.model;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

public record OpenInterestSnapshot(
        String symbol,
        BigDecimal totalOi,
        BigDecimal longOi,
        BigDecimal shortOi,
        long timestamp
) implements Timestamped {

    private static final BigDecimal HALF = new BigDecimal("0.5");
    private static final MathContext MC = new MathContext(12, RoundingMode.HALF_UP);

    public OpenInterestSnapshot {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol must not be blank");
        }
        if (totalOi == null || totalOi.signum() < 0) {
            throw new IllegalArgumentException("totalOi must be non-negative");
        }
        symbol = symbol.toUpperCase();
        if (longOi == null || shortOi == null) {
            longOi = totalOi.multiply(HALF);
            shortOi = totalOi.multiply(HALF);
        }
    }

    public static OpenInterestSnapshot evenSplit(String symbol, BigDecimal totalOi, long timestamp) {
        return new OpenInterestSnapshot(symbol, totalOi, null, null, timestamp);
    }

    /**
     * Re-splits the total in proportion to the book's bid and ask notional. A missing or empty
     * book leaves the snapshot unchanged.
     */
    public OpenInterestSnapshot splitBy(OrderBookImbalance book) {
        if (book == null || book.isEmpty()) {
            return this;
        }
        BigDecimal depthTotal = book.bidNotional().add(book.askNotional(), MC);
        BigDecimal longShare = totalOi.multiply(book.bidNotional(), MC).divide(depthTotal, MC);
        BigDecimal shortShare = totalOi.multiply(book.askNotional(), MC).divide(depthTotal, MC);
        return new OpenInterestSnapshot(symbol, totalOi, longShare, shortShare, timestamp);
    }

    public double longShortRatio() {
        if (shortOi.signum() == 0) return 1.0;
        return longOi.doubleValue() / shortOi.doubleValue();
    }
}
