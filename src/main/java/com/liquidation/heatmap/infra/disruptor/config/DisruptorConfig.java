package com.liquidation.heatmap.infra.disruptor.config;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.liquidation.heatmap.infra.disruptor.event.MarketDataEvent;
import com.liquidation.heatmap.infra.disruptor.event.MarketDataEventFactory;
import com.liquidation.heatmap.infra.disruptor.handler.DisruptorExceptionHandler;
import com.liquidation.heatmap.infra.disruptor.handler.ParseEventHandler;
import com.liquidation.heatmap.infra.disruptor.handler.StreamIngestHandler;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Stream pipeline: WebSocket reader → Parse → Ingest (reactive buffer and pushed mark prices).
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class DisruptorConfig {

    private final ParseEventHandler parseEventHandler;
    private final StreamIngestHandler streamIngestHandler;
    private final IngestProperties ingestProperties;
    private final MeterRegistry meterRegistry;

    private Disruptor<MarketDataEvent> ingestDisruptor;

    @Bean
    public Disruptor<MarketDataEvent> marketDataDisruptor() {
        WaitStrategy waitStrategy = waitStrategy(ingestProperties.getWaitStrategy());
        int size = ingestProperties.getRingBufferSize();

        // reconnects can briefly overlap two OkHttp reader threads
        ingestDisruptor = new Disruptor<>(
                new MarketDataEventFactory(),
                size,
                ingestThreadFactory(),
                ProducerType.MULTI,
                waitStrategy);
        ingestDisruptor.setDefaultExceptionHandler(new DisruptorExceptionHandler(meterRegistry));
        ingestDisruptor
                .handleEventsWith(parseEventHandler)
                .then(streamIngestHandler);
        ingestDisruptor.start();

        log.info("[Disruptor] 스트림 파이프라인 기동: Parse → Ingest | size={}, wait={}",
                size, waitStrategy.getClass().getSimpleName());
        return ingestDisruptor;
    }

    @Bean
    public RingBuffer<MarketDataEvent> marketDataRingBuffer(Disruptor<MarketDataEvent> marketDataDisruptor) {
        return marketDataDisruptor.getRingBuffer();
    }

    @PreDestroy
    public void shutdown() {
        if (ingestDisruptor != null) {
            ingestDisruptor.shutdown();
            log.info("[Disruptor] 스트림 파이프라인 종료");
        }
    }

    static WaitStrategy waitStrategy(IngestProperties.WaitStrategyType type) {
        return switch (type) {
            case YIELDING -> new YieldingWaitStrategy();
            case BLOCKING -> new BlockingWaitStrategy();
            case SLEEPING -> new SleepingWaitStrategy();
        };
    }

    private static ThreadFactory ingestThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "heatmap-ingest-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
