package com.liquidation.heatmap.infra.disruptor.monitor;

import com.lmax.disruptor.RingBuffer;
import com.liquidation.heatmap.infra.disruptor.event.MarketDataEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class DisruptorMetricsCollector {

    private final RingBuffer<MarketDataEvent> marketDataRingBuffer;
    private final MeterRegistry meterRegistry;

    @PostConstruct
    public void init() {
        Gauge.builder("disruptor.ringbuffer.utilization", marketDataRingBuffer, DisruptorMetricsCollector::utilization)
                .tag("pipeline", "ingest")
                .description("Ingest RingBuffer utilization (0.0~1.0)")
                .register(meterRegistry);

        Gauge.builder("disruptor.ringbuffer.remaining", marketDataRingBuffer,
                        rb -> (double) rb.remainingCapacity())
                .tag("pipeline", "ingest")
                .description("Ingest RingBuffer remaining capacity")
                .register(meterRegistry);

        log.info("[Metrics] Disruptor RingBuffer 모니터링 등록 완료");
    }

    @Scheduled(fixedRate = 30_000)
    public void logMetricsSummary() {
        Counter liquidations = meterRegistry.find("heatmap.stream.liquidations").counter();
        double dropped = sum("heatmap.stream.dropped");
        double exceptions = sum("heatmap.ingest.exceptions");

        log.info("[Metrics] Ingest RB: {}% ({}/{}) | liquidations={} | dropped={} | exceptions={}",
                String.format("%.1f", utilization(marketDataRingBuffer) * 100),
                marketDataRingBuffer.getBufferSize() - marketDataRingBuffer.remainingCapacity(),
                marketDataRingBuffer.getBufferSize(),
                liquidations != null ? (long) liquidations.count() : 0,
                (long) dropped,
                (long) exceptions);
    }

    private double sum(String counterName) {
        return meterRegistry.find(counterName).counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }

    private static double utilization(RingBuffer<MarketDataEvent> ringBuffer) {
        return 1.0 - ((double) ringBuffer.remainingCapacity() / ringBuffer.getBufferSize());
    }
}
