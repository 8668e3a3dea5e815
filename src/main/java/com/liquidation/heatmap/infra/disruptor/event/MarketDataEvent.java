package com.liquidation.heatmap.infra.disruptor.event;

import com.liquidation.heatmap.domain.model.LiquidationEvent;
import com.liquidation.heatmap.domain.model.PriceSnapshot;

public class MarketDataEvent {

    private EventType type;
    private String symbol;
    private String rawJson;
    private long ingestNanoTime;

    private PriceSnapshot markPrice;
    private LiquidationEvent liquidationEvent;

    public void clear() {
        type = null;
        symbol = null;
        rawJson = null;
        ingestNanoTime = 0L;
        markPrice = null;
        liquidationEvent = null;
    }

    public EventType getType() {
        return type;
    }

    public void setType(EventType type) {
        this.type = type;
    }

    public String getSymbol() {
        return symbol;
    }

    public void setSymbol(String symbol) {
        this.symbol = symbol;
    }

    public String getRawJson() {
        return rawJson;
    }

    public void setRawJson(String rawJson) {
        this.rawJson = rawJson;
    }

    public long getIngestNanoTime() {
        return ingestNanoTime;
    }

    public void setIngestNanoTime(long ingestNanoTime) {
        this.ingestNanoTime = ingestNanoTime;
    }

    public PriceSnapshot getMarkPrice() {
        return markPrice;
    }

    public void setMarkPrice(PriceSnapshot markPrice) {
        this.markPrice = markPrice;
    }

    public LiquidationEvent getLiquidationEvent() {
        return liquidationEvent;
    }

    public void setLiquidationEvent(LiquidationEvent liquidationEvent) {
        this.liquidationEvent = liquidationEvent;
    }

    @Override
    public String toString() {
        return "MarketDataEvent{type=" + type + ", symbol=" + symbol + "}";
    }
}
