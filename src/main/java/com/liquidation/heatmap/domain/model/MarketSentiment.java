package com.liquidation.heatmap.domain.model;

import java.math.BigDecimal;

public record MarketSentiment(
        String symbol,
        Bias sentiment,
        BiasStrength biasStrength,
        double longShortRatio,
        BigDecimal totalOi,
        BigDecimal longOi,
        BigDecimal shortOi,
        String interpretation
) {

    public enum Bias {
        BULLISH_BIAS, BEARISH_BIAS, NEUTRAL, UNKNOWN
    }

    public enum BiasStrength {
        HIGH, MODERATE, LOW, UNKNOWN
    }

    public static MarketSentiment unknown(String symbol) {
        return new MarketSentiment(symbol, Bias.UNKNOWN, BiasStrength.UNKNOWN, 1.0,
                BigDecimal.ZERO, null, null, "No OI data available");
    }
}
