package com.liquidation.heatmap.domain.service;

import com.liquidation.heatmap.domain.model.LiquidationEvent;
import com.liquidation.heatmap.domain.model.PositionSide;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LiquidationEventBufferTest {

    @Test
    @DisplayName("oldest events are evicted first once capacity is reached")
    void fifoEviction() {
        LiquidationEventBuffer buffer = new LiquidationEventBuffer(3);
        for (int i = 1; i <= 5; i++) {
            buffer.append(event("BTCUSDT", "e" + i));
        }

        assertEquals(3, buffer.size("BTCUSDT"));
        assertEquals(List.of("e3", "e4", "e5"),
                buffer.snapshot("BTCUSDT").stream().map(LiquidationEvent::getEventId).toList());
    }

    @Test
    @DisplayName("snapshot is an immutable copy unaffected by later appends")
    void snapshotIsCopy() {
        LiquidationEventBuffer buffer = new LiquidationEventBuffer(10);
        buffer.append(event("BTCUSDT", "e1"));

        List<LiquidationEvent> snapshot = buffer.snapshot("BTCUSDT");
        buffer.append(event("BTCUSDT", "e2"));

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(event("BTCUSDT", "x")));
    }

    @Test
    @DisplayName("symbols are isolated and matched case-insensitively")
    void perSymbol() {
        LiquidationEventBuffer buffer = new LiquidationEventBuffer(10);
        buffer.append(event("BTCUSDT", "b1"));
        buffer.append(event("ETHUSDT", "e1"));
        buffer.append(event("ETHUSDT", "e2"));

        assertEquals(1, buffer.size("btcusdt"));
        assertEquals(2, buffer.snapshot("ethusdt").size());
        assertTrue(buffer.snapshot("SOLUSDT").isEmpty());
    }

    @Test
    @DisplayName("invalid events are rejected")
    void rejectsInvalid() {
        LiquidationEventBuffer buffer = new LiquidationEventBuffer(10);
        LiquidationEvent noPrice = LiquidationEvent.builder()
                .eventId("bad").symbol("BTCUSDT").side(PositionSide.LONG)
                .notional(BigDecimal.TEN).timestamp(1L)
                .build();

        assertFalse(buffer.append(noPrice));
        assertFalse(buffer.append(null));
        assertEquals(0, buffer.size("BTCUSDT"));
    }

    @Test
    @DisplayName("concurrent appends never exceed capacity")
    void concurrentAppends() throws InterruptedException {
        LiquidationEventBuffer buffer = new LiquidationEventBuffer(100);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(4);
        for (int t = 0; t < 4; t++) {
            int thread = t;
            pool.submit(() -> {
                for (int i = 0; i < 500; i++) {
                    buffer.append(event("BTCUSDT", thread + "-" + i));
                }
                done.countDown();
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdownNow();
        assertEquals(100, buffer.size("BTCUSDT"));
        assertEquals(100, buffer.snapshot("BTCUSDT").size());
    }

    @Test
    @DisplayName("capacity must be positive")
    void invalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new LiquidationEventBuffer(0));
    }

    private LiquidationEvent event(String symbol, String id) {
        return LiquidationEvent.builder()
                .eventId(id)
                .symbol(symbol)
                .side(PositionSide.SHORT)
                .price(new BigDecimal("101"))
                .notional(new BigDecimal("1000"))
                .timestamp(1_000L)
                .build();
    }
}
