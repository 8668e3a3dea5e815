package com.liquidation.heatmap.domain.service;

import com.liquidation.heatmap.domain.model.OpenInterestSnapshot;
import com.liquidation.heatmap.domain.model.OrderBookImbalance;
import com.liquidation.heatmap.domain.model.PriceSnapshot;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Upstream market data. Implementations throw {@link com.liquidation.heatmap.domain.exception.MarketDataException}
 * when the venue cannot be reached or answers with garbage. Every fetch method issues exactly one
 * request, so one rate limiter permit covers one call.
 */
public interface MarketDataSource {

    /** Upper-case symbols this source can serve. */
    Set<String> supportedSymbols();

    PriceSnapshot fetchPrice(String symbol);

    /** Open interest in quote currency, valued at {@code price} and split evenly. */
    OpenInterestSnapshot fetchOpenInterest(String symbol, BigDecimal price);

    OrderBookImbalance fetchOrderBook(String symbol);
}
