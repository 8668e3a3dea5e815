package com.liquidation.heatmap.infra.binance.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lmax.disruptor.RingBuffer;
import com.liquidation.heatmap.infra.binance.config.BinanceProperties;
import com.liquidation.heatmap.infra.disruptor.event.EventType;
import com.liquidation.heatmap.infra.disruptor.event.MarketDataEvent;
import com.liquidation.heatmap.infra.disruptor.event.MarketDataEventFactory;
import com.liquidation.heatmap.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class BinanceWebSocketClientTest {

    private RingBuffer<MarketDataEvent> ringBuffer;
    private SimpleMeterRegistry meterRegistry;
    private BinanceWebSocketClient client;

    @BeforeEach
    void setUp() {
        BinanceProperties properties = new BinanceProperties();
        properties.setSymbols(List.of("btcusdt"));
        ringBuffer = RingBuffer.createMultiProducer(new MarketDataEventFactory(), 8);
        meterRegistry = new SimpleMeterRegistry();
        client = new BinanceWebSocketClient(mock(OkHttpClient.class), properties, new ObjectMapper(),
                ringBuffer, meterRegistry, new MutableClock(1_000L));
    }

    @Test
    @DisplayName("combined-stream message is published with its type, symbol and raw data")
    void publishes() {
        String message = "{\"stream\":\"btcusdt@forceOrder\",\"data\":{\"e\":\"forceOrder\",\"E\":1}}";

        assertTrue(client.routeMessage(message));

        MarketDataEvent event = ringBuffer.get(ringBuffer.getCursor());
        assertEquals(EventType.FORCE_ORDER, event.getType());
        assertEquals("BTCUSDT", event.getSymbol());
        assertEquals("{\"e\":\"forceOrder\",\"E\":1}", event.getRawJson());
        assertEquals(1.0, meterRegistry.get("heatmap.stream.messages").tag("type", "FORCE_ORDER").counter().count());
    }

    @Test
    @DisplayName("malformed, unknown-stream and unconfigured-symbol messages are dropped")
    void drops() {
        long cursor = ringBuffer.getCursor();

        assertFalse(client.routeMessage("{broken"));
        assertFalse(client.routeMessage("{\"result\":null,\"id\":1}"));
        assertFalse(client.routeMessage("{\"stream\":\"btcusdt@aggTrade\",\"data\":{}}"));
        assertFalse(client.routeMessage("{\"stream\":\"dogeusdt@markPrice@1s\",\"data\":{}}"));

        assertEquals(cursor, ringBuffer.getCursor());
        assertEquals(1.0, meterRegistry.get("heatmap.stream.dropped").tag("reason", "unsupported_symbol").counter().count());
    }

    @Test
    @DisplayName("health is DOWN until the socket opens")
    void health() {
        assertEquals(Status.DOWN, client.health().getStatus());
        assertFalse(client.isConnected());
    }
}
