package com.liquidation.heatmap.infra.disruptor.event;

public enum EventType {

    MARK_PRICE,
    FORCE_ORDER,
    UNKNOWN;

    public static EventType fromStream(String streamName) {
        if (streamName == null) return UNKNOWN;
        if (streamName.contains("@markPrice")) return MARK_PRICE;
        if (streamName.contains("@forceOrder")) return FORCE_ORDER;
        return UNKNOWN;
    }
}
