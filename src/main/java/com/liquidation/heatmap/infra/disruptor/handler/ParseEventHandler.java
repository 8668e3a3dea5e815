package com.liquidation.heatmap.infra.disruptor.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lmax.disruptor.EventHandler;
import com.liquidation.heatmap.domain.model.LiquidationEvent;
import com.liquidation.heatmap.domain.model.PositionSide;
import com.liquidation.heatmap.domain.model.PriceSnapshot;
import com.liquidation.heatmap.infra.binance.dto.ForceOrderEvent;
import com.liquidation.heatmap.infra.binance.dto.MarkPriceEvent;
import com.liquidation.heatmap.infra.disruptor.event.MarketDataEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;

@Slf4j
@Component
@RequiredArgsConstructor
public class ParseEventHandler implements EventHandler<MarketDataEvent> {

    private static final MathContext MC = new MathContext(12, RoundingMode.HALF_UP);

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public void onEvent(MarketDataEvent event, long sequence, boolean endOfBatch) {
        if (event.getType() == null) return;

        switch (event.getType()) {
            case MARK_PRICE -> parseMarkPrice(event, event.getRawJson());
            case FORCE_ORDER -> parseForceOrder(event, event.getRawJson(), sequence);
            default -> log.debug("[Parse] 미지원 이벤트 타입: {}", event.getType());
        }
    }

    private void parseMarkPrice(MarketDataEvent event, String rawJson) {
        try {
            MarkPriceEvent markPrice = objectMapper.readValue(rawJson, MarkPriceEvent.class);
            String symbol = markPrice.getSymbol() != null ? markPrice.getSymbol() : event.getSymbol();
            long timestamp = notAfterNow(markPrice.getEventTime());

            event.setMarkPrice(new PriceSnapshot(symbol, markPrice.getMarkPrice(), timestamp));
            log.trace("[Parse] MARK_PRICE symbol={}, price={}", symbol, markPrice.getMarkPrice());
        } catch (Exception e) {
            log.error("[Parse] MARK_PRICE 파싱 실패: {}", rawJson, e);
        }
    }

    private void parseForceOrder(MarketDataEvent event, String rawJson, long sequence) {
        try {
            ForceOrderEvent forceOrder = objectMapper.readValue(rawJson, ForceOrderEvent.class);
            ForceOrderEvent.Order order = forceOrder.getOrder();

            BigDecimal price = order.getAveragePrice() != null && order.getAveragePrice().signum() > 0
                    ? order.getAveragePrice()
                    : order.getPrice();
            BigDecimal quantity = order.getAccumulatedFilledQuantity() != null && order.getAccumulatedFilledQuantity().signum() > 0
                    ? order.getAccumulatedFilledQuantity()
                    : order.getOriginalQuantity();
            BigDecimal notional = price.multiply(quantity, MC);

            long timestamp = notAfterNow(order.getTradeTime() != null ? order.getTradeTime() : forceOrder.getEventTime());
            String symbol = order.getSymbol().toUpperCase();

            LiquidationEvent liqEvent = LiquidationEvent.builder()
                    .eventId(symbol + "-" + timestamp + "-" + sequence)
                    .symbol(symbol)
                    .side(PositionSide.fromForceOrderSide(order.getSide()))
                    .price(price)
                    .notional(notional)
                    .timestamp(timestamp)
                    .build();

            event.setLiquidationEvent(liqEvent);
            log.info("[Parse] FORCE_ORDER symbol={}, orderSide={} → liquidated={}, price={}, qty={}, notional={}",
                    symbol, order.getSide(), liqEvent.getSide(), price, quantity, notional);
        } catch (Exception e) {
            log.error("[Parse] FORCE_ORDER 파싱 실패: {}", rawJson, e);
        }
    }

    /** Exchange time, capped at local arrival time; missing times fall back to arrival. */
    private long notAfterNow(Long exchangeTime) {
        long now = clock.millis();
        return exchangeTime == null ? now : Math.min(exchangeTime, now);
    }
}
