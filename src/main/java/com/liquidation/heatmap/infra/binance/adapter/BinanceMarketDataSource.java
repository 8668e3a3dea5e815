package com.liquidation.heatmap.infra.binance.adapter;

import com.liquidation.heatmap.domain.model.OpenInterestSnapshot;
import com.liquidation.heatmap.domain.model.OrderBookImbalance;
import com.liquidation.heatmap.domain.model.PriceSnapshot;
import com.liquidation.heatmap.domain.service.MarketDataSource;
import com.liquidation.heatmap.infra.binance.client.BinanceRestClient;
import com.liquidation.heatmap.infra.binance.config.BinanceProperties;
import com.liquidation.heatmap.infra.binance.dto.DepthResponse;
import com.liquidation.heatmap.infra.binance.dto.OpenInterestResponse;
import com.liquidation.heatmap.infra.binance.dto.TickerPriceResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Set;

/**
 * One REST request per fetch. Open interest contracts are valued with the price the caller
 * already holds; the long/short split comes from {@link #fetchOrderBook(String)}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BinanceMarketDataSource implements MarketDataSource {

    private static final MathContext MC = new MathContext(12, RoundingMode.HALF_UP);

    private final BinanceRestClient restClient;
    private final BinanceProperties properties;
    private final Clock clock;

    @Override
    public Set<String> supportedSymbols() {
        return properties.upperCaseSymbols();
    }

    @Override
    public PriceSnapshot fetchPrice(String symbol) {
        TickerPriceResponse ticker = restClient.getTickerPrice(symbol);
        long timestamp = ticker.getTime() != null ? ticker.getTime() : clock.millis();
        return new PriceSnapshot(symbol, ticker.getPrice(), timestamp);
    }

    @Override
    public OpenInterestSnapshot fetchOpenInterest(String symbol, BigDecimal price) {
        OpenInterestResponse oi = restClient.getOpenInterest(symbol);
        BigDecimal totalUsd = oi.getOpenInterest().multiply(price, MC);
        long timestamp = oi.getTime() != null ? oi.getTime() : clock.millis();

        log.debug("[Binance OI] {} contracts={} price={} totalUsd={}",
                symbol, oi.getOpenInterest().toPlainString(), price.toPlainString(), totalUsd.toPlainString());
        return OpenInterestSnapshot.evenSplit(symbol, totalUsd, timestamp);
    }

    @Override
    public OrderBookImbalance fetchOrderBook(String symbol) {
        DepthResponse depth = restClient.getDepth(symbol);
        long timestamp = depth.getTransactionTime() != null ? depth.getTransactionTime() : clock.millis();
        return new OrderBookImbalance(symbol, depth.bidNotional(), depth.askNotional(), timestamp);
    }
}
