package com.liquidation.heatmap.infra.disruptor.handler;

import com.lmax.disruptor.ExceptionHandler;
import com.liquidation.heatmap.infra.disruptor.event.EventType;
import com.liquidation.heatmap.infra.disruptor.event.MarketDataEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * A failing event is counted and dropped; the pipeline keeps running.
 */
@Slf4j
public class DisruptorExceptionHandler implements ExceptionHandler<MarketDataEvent> {

    private final MeterRegistry meterRegistry;

    public DisruptorExceptionHandler(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void handleEventException(Throwable ex, long sequence, MarketDataEvent event) {
        EventType type = event != null && event.getType() != null ? event.getType() : EventType.UNKNOWN;
        Counter.builder("heatmap.ingest.exceptions")
                .tag("type", type.name())
                .description("Stream events dropped after a handler exception")
                .register(meterRegistry)
                .increment();

        log.error("[Ingest] {} 이벤트 처리 예외 → 드롭 (seq={}, symbol={})",
                type, sequence, event != null ? event.getSymbol() : null, ex);
        if (event != null) {
            event.clear();
        }
    }

    @Override
    public void handleOnStartException(Throwable ex) {
        log.error("[Ingest] 핸들러 시작 예외", ex);
    }

    @Override
    public void handleOnShutdownException(Throwable ex) {
        log.error("[Ingest] 핸들러 종료 예외", ex);
    }
}
