package com.liquidation.heatmap.domain.model;

public enum PositionSide {

    LONG,
    SHORT;

    public static PositionSide fromForceOrderSide(String orderSide) {
        if ("SELL".equalsIgnoreCase(orderSide)) return LONG;
        if ("BUY".equalsIgnoreCase(orderSide)) return SHORT;
        throw new IllegalArgumentException("unknown force order side: " + orderSide);
    }
}
