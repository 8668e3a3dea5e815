package com.liquidation.heatmap.infra.disruptor.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.liquidation.heatmap.domain.model.LiquidationEvent;
import com.liquidation.heatmap.domain.model.PositionSide;
import com.liquidation.heatmap.domain.model.PriceSnapshot;
import com.liquidation.heatmap.infra.disruptor.event.EventType;
import com.liquidation.heatmap.infra.disruptor.event.MarketDataEvent;
import com.liquidation.heatmap.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class ParseEventHandlerTest {

    private static final String FORCE_ORDER = """
            {"e":"forceOrder","E":1568014460893,"o":{"s":"BTCUSDT","S":"SELL","o":"LIMIT","f":"IOC",
            "q":"0.014","p":"9910","ap":"9910","X":"FILLED","l":"0.014","z":"0.014","T":1568014460893}}
            """;

    private final MutableClock clock = new MutableClock(1_700_000_000_000L);
    private final ParseEventHandler handler = new ParseEventHandler(new ObjectMapper(), clock);

    private MarketDataEvent event(EventType type, String json) {
        MarketDataEvent event = new MarketDataEvent();
        event.setType(type);
        event.setSymbol("BTCUSDT");
        event.setRawJson(json);
        return event;
    }

    @Nested
    @DisplayName("forceOrder")
    class ForceOrder {

        @Test
        @DisplayName("SELL order is a liquidated LONG with notional = price × filled qty")
        void sellIsLong() {
            MarketDataEvent event = event(EventType.FORCE_ORDER, FORCE_ORDER);

            handler.onEvent(event, 7L, true);

            LiquidationEvent liq = event.getLiquidationEvent();
            assertNotNull(liq);
            assertEquals("BTCUSDT", liq.getSymbol());
            assertEquals(PositionSide.LONG, liq.getSide());
            assertEquals(0, new BigDecimal("9910").compareTo(liq.getPrice()));
            assertEquals(0, new BigDecimal("138.74").compareTo(liq.getNotional()));
            assertEquals(1568014460893L, liq.getTimestamp());
            assertEquals("BTCUSDT-1568014460893-7", liq.getEventId());
        }

        @Test
        @DisplayName("BUY order is a liquidated SHORT; order price and quantity are used when fills are absent")
        void buyFallsBackToOrderFields() {
            String json = """
                    {"e":"forceOrder","E":1000,"o":{"s":"ethusdt","S":"BUY","q":"2","p":"1500","ap":"0","T":900}}
                    """;
            MarketDataEvent event = event(EventType.FORCE_ORDER, json);

            handler.onEvent(event, 1L, true);

            LiquidationEvent liq = event.getLiquidationEvent();
            assertEquals("ETHUSDT", liq.getSymbol());
            assertEquals(PositionSide.SHORT, liq.getSide());
            assertEquals(0, new BigDecimal("1500").compareTo(liq.getPrice()));
            assertEquals(0, new BigDecimal("3000").compareTo(liq.getNotional()));
            assertEquals(900L, liq.getTimestamp());
        }

        @Test
        @DisplayName("exchange time ahead of the local clock is capped at arrival")
        void futureTradeTimeCapped() {
            long ahead = clock.millis() + 60_000;
            String json = """
                    {"e":"forceOrder","E":%d,"o":{"s":"BTCUSDT","S":"SELL","q":"1","p":"100","ap":"100","z":"1","T":%d}}
                    """.formatted(ahead, ahead);
            MarketDataEvent event = event(EventType.FORCE_ORDER, json);

            handler.onEvent(event, 2L, true);

            assertEquals(clock.millis(), event.getLiquidationEvent().getTimestamp());
        }

        @Test
        @DisplayName("malformed payloads are dropped without throwing")
        void malformed() {
            MarketDataEvent garbage = event(EventType.FORCE_ORDER, "{not json");
            MarketDataEvent noOrder = event(EventType.FORCE_ORDER, "{\"e\":\"forceOrder\"}");
            MarketDataEvent badSide = event(EventType.FORCE_ORDER, FORCE_ORDER.replace("\"SELL\"", "\"HOLD\""));

            assertDoesNotThrow(() -> {
                handler.onEvent(garbage, 1L, false);
                handler.onEvent(noOrder, 2L, false);
                handler.onEvent(badSide, 3L, true);
            });
            assertNull(garbage.getLiquidationEvent());
            assertNull(noOrder.getLiquidationEvent());
            assertNull(badSide.getLiquidationEvent());
        }
    }

    @Nested
    @DisplayName("markPrice")
    class MarkPrice {

        @Test
        @DisplayName("mark price update becomes a price snapshot at the event time")
        void parsed() {
            String json = """
                    {"e":"markPriceUpdate","E":1562305380000,"s":"BTCUSDT","p":"11794.15000000","i":"11784.62659091"}
                    """;
            MarketDataEvent event = event(EventType.MARK_PRICE, json);

            handler.onEvent(event, 1L, true);

            PriceSnapshot price = event.getMarkPrice();
            assertEquals("BTCUSDT", price.symbol());
            assertEquals(0, new BigDecimal("11794.15").compareTo(price.price()));
            assertEquals(1562305380000L, price.timestamp());
        }

        @Test
        @DisplayName("missing event time falls back to the clock")
        void clockFallback() {
            MarketDataEvent event = event(EventType.MARK_PRICE, "{\"s\":\"BTCUSDT\",\"p\":\"100\"}");

            handler.onEvent(event, 1L, true);

            assertEquals(clock.millis(), event.getMarkPrice().timestamp());
        }

        @Test
        @DisplayName("non-positive mark price is dropped")
        void invalidPrice() {
            MarketDataEvent event = event(EventType.MARK_PRICE, "{\"s\":\"BTCUSDT\",\"p\":\"0\",\"E\":1}");

            handler.onEvent(event, 1L, true);

            assertNull(event.getMarkPrice());
        }
    }
}
