package com.liquidation.heatmap.infra.disruptor.handler;

import com.lmax.disruptor.EventHandler;
import com.liquidation.heatmap.domain.model.LiquidationEvent;
import com.liquidation.heatmap.domain.model.PriceSnapshot;
import com.liquidation.heatmap.domain.service.LiquidationEventBuffer;
import com.liquidation.heatmap.domain.service.refresh.DataKind;
import com.liquidation.heatmap.domain.service.refresh.RefreshScheduler;
import com.liquidation.heatmap.infra.disruptor.event.MarketDataEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class StreamIngestHandler implements EventHandler<MarketDataEvent> {

    private final LiquidationEventBuffer eventBuffer;
    private final RefreshScheduler refreshScheduler;
    private final Counter liquidationCounter;
    private final Counter rejectedPriceCounter;

    public StreamIngestHandler(
            LiquidationEventBuffer eventBuffer,
            RefreshScheduler refreshScheduler,
            MeterRegistry meterRegistry) {
        this.eventBuffer = eventBuffer;
        this.refreshScheduler = refreshScheduler;
        this.liquidationCounter = Counter.builder("heatmap.stream.liquidations")
                .description("Liquidation events appended to the reactive buffer")
                .register(meterRegistry);
        this.rejectedPriceCounter = Counter.builder("heatmap.stream.mark_price.rejected")
                .description("Streamed mark prices older than the cached price")
                .register(meterRegistry);
    }

    @Override
    public void onEvent(MarketDataEvent event, long sequence, boolean endOfBatch) {
        if (event.getType() == null) return;

        switch (event.getType()) {
            case MARK_PRICE -> handleMarkPrice(event);
            case FORCE_ORDER -> handleForceOrder(event);
            default -> { }
        }
    }

    private void handleMarkPrice(MarketDataEvent event) {
        PriceSnapshot price = event.getMarkPrice();
        if (price == null) return;

        if (!refreshScheduler.offer(price.symbol(), DataKind.PRICE, price)) {
            rejectedPriceCounter.increment();
        }
    }

    private void handleForceOrder(MarketDataEvent event) {
        LiquidationEvent liq = event.getLiquidationEvent();
        if (liq == null) return;

        if (eventBuffer.append(liq)) {
            liquidationCounter.increment();
            log.debug("[Ingest] FORCE_ORDER 버퍼 적재: symbol={}, side={}, size={}",
                    liq.getSymbol(), liq.getSide(), eventBuffer.size(liq.getSymbol()));
        }
    }
}
