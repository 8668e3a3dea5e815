package com.liquidation.heatmap.domain.service;

import com.liquidation.heatmap.domain.model.LiquidationEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-symbol FIFO of recent liquidation events. When full, the oldest event is evicted.
 */
@Slf4j
@Component
public class LiquidationEventBuffer {

    private final Map<String, CircularBuffer> buffers = new ConcurrentHashMap<>();
    private final int capacity;

    @Autowired
    public LiquidationEventBuffer(ClusterProperties clusterProperties) {
        this(clusterProperties.getReactive().getBufferCapacity());
    }

    LiquidationEventBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public boolean append(LiquidationEvent event) {
        if (event == null || !event.isValid()) {
            log.debug("[EventBuffer] 유효하지 않은 이벤트 무시: {}", event);
            return false;
        }
        String key = event.getSymbol().toUpperCase();
        boolean evicted = buffers.computeIfAbsent(key, k -> new CircularBuffer(capacity)).add(event);
        if (evicted) {
            log.trace("[EventBuffer] {} 용량 초과로 가장 오래된 이벤트 제거 (capacity={})", key, capacity);
        }
        return true;
    }

    public List<LiquidationEvent> snapshot(String symbol) {
        if (symbol == null) return List.of();
        CircularBuffer buffer = buffers.get(symbol.toUpperCase());
        return buffer == null ? List.of() : buffer.snapshot();
    }

    public int size(String symbol) {
        if (symbol == null) return 0;
        CircularBuffer buffer = buffers.get(symbol.toUpperCase());
        return buffer == null ? 0 : buffer.size();
    }

    public Set<String> symbols() {
        return Set.copyOf(buffers.keySet());
    }

    public int getCapacity() {
        return capacity;
    }

    static final class CircularBuffer {

        private final LiquidationEvent[] elements;
        private long head;
        private long tail;

        CircularBuffer(int capacity) {
            this.elements = new LiquidationEvent[capacity];
        }

        synchronized boolean add(LiquidationEvent event) {
            boolean evicted = false;
            if (tail - head == elements.length) {
                elements[(int) (head % elements.length)] = null;
                head++;
                evicted = true;
            }
            elements[(int) (tail % elements.length)] = event;
            tail++;
            return evicted;
        }

        synchronized List<LiquidationEvent> snapshot() {
            List<LiquidationEvent> result = new ArrayList<>((int) (tail - head));
            for (long i = head; i < tail; i++) {
                result.add(elements[(int) (i % elements.length)]);
            }
            return List.copyOf(result);
        }

        synchronized int size() {
            return (int) (tail - head);
        }
    }
}
