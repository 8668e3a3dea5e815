package com.liquidation.heatmap.infra.binance.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.liquidation.heatmap.domain.exception.MarketDataException;
import com.liquidation.heatmap.infra.binance.config.BinanceProperties;
import com.liquidation.heatmap.infra.binance.dto.DepthResponse;
import com.liquidation.heatmap.infra.binance.dto.OpenInterestResponse;
import com.liquidation.heatmap.infra.binance.dto.TickerPriceResponse;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Slf4j
@Component
public class BinanceRestClient {

    private final OkHttpClient okHttpClient;
    private final BinanceProperties properties;
    private final ObjectMapper objectMapper;

    public BinanceRestClient(
            @Qualifier("binanceRestHttpClient") OkHttpClient okHttpClient,
            BinanceProperties properties,
            ObjectMapper objectMapper) {
        this.okHttpClient = okHttpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public TickerPriceResponse getTickerPrice(String symbol) {
        String url = properties.getRestBaseUrl()
                + "/fapi/v1/ticker/price?symbol=" + symbol.toUpperCase();
        TickerPriceResponse ticker = get(url, "Ticker", symbol, TickerPriceResponse.class);
        if (ticker.getPrice() == null) {
            throw new MarketDataException("Ticker response without price: symbol=" + symbol);
        }
        log.debug("[Binance REST] Ticker 수신: symbol={}, price={}", symbol, ticker.getPrice());
        return ticker;
    }

    public OpenInterestResponse getOpenInterest(String symbol) {
        String url = properties.getRestBaseUrl()
                + "/fapi/v1/openInterest?symbol=" + symbol.toUpperCase();
        OpenInterestResponse oi = get(url, "OI", symbol, OpenInterestResponse.class);
        if (oi.getOpenInterest() == null) {
            throw new MarketDataException("OI response without openInterest: symbol=" + symbol);
        }
        log.info("[Binance REST] OI 수신: symbol={}, openInterest={}", symbol, oi.getOpenInterest());
        return oi;
    }

    public DepthResponse getDepth(String symbol) {
        String url = properties.getRestBaseUrl()
                + "/fapi/v1/depth?symbol=" + symbol.toUpperCase() + "&limit=" + properties.getDepthLimit();
        DepthResponse depth = get(url, "Depth", symbol, DepthResponse.class);
        log.debug("[Binance REST] Depth 수신: symbol={}, bids={}, asks={}", symbol,
                depth.getBids() == null ? 0 : depth.getBids().size(),
                depth.getAsks() == null ? 0 : depth.getAsks().size());
        return depth;
    }

    private <T> T get(String url, String label, String symbol, Class<T> type) {
        Request request = new Request.Builder().url(url).get().build();

        try (Response response = okHttpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                log.warn("[Binance REST] {} 요청 실패: symbol={}, code={}", label, symbol, response.code());
                throw new MarketDataException(label + " request failed: symbol=" + symbol + ", code=" + response.code());
            }

            ResponseBody body = response.body();
            if (body == null) {
                throw new MarketDataException(label + " response without body: symbol=" + symbol);
            }
            return objectMapper.readValue(body.string(), type);

        } catch (IOException e) {
            log.error("[Binance REST] {} 요청 예외: symbol={}", label, symbol, e);
            throw new MarketDataException(label + " request error: symbol=" + symbol, e);
        }
    }
}
