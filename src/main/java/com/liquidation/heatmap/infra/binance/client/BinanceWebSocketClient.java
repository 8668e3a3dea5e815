package com.liquidation.heatmap.infra.binance.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lmax.disruptor.RingBuffer;
import com.liquidation.heatmap.infra.binance.config.BinanceProperties;
import com.liquidation.heatmap.infra.disruptor.event.EventType;
import com.liquidation.heatmap.infra.disruptor.event.MarketDataEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Combined forceOrder + markPrice stream for the configured symbols. Messages are published
 * raw onto the ingest ring buffer; parsing happens on the pipeline thread.
 */
@Slf4j
@Component("binanceStream")
@ConditionalOnProperty(prefix = "binance", name = "stream-enabled", havingValue = "true", matchIfMissing = true)
public class BinanceWebSocketClient implements HealthIndicator {

    private static final long MAX_RECONNECT_DELAY_MS = 60_000;

    private final OkHttpClient okHttpClient;
    private final BinanceProperties properties;
    private final ObjectMapper objectMapper;
    private final RingBuffer<MarketDataEvent> marketDataRingBuffer;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Set<String> symbols;

    private volatile WebSocket webSocket;
    private final AtomicBoolean connected = new AtomicBoolean(false);
    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);
    private final AtomicInteger reconnectCount = new AtomicInteger(0);
    private final AtomicLong lastMessageAt = new AtomicLong(0);
    private final ScheduledExecutorService reconnectScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "binance-ws-reconnect");
        thread.setDaemon(true);
        return thread;
    });

    public BinanceWebSocketClient(
            OkHttpClient okHttpClient,
            BinanceProperties properties,
            ObjectMapper objectMapper,
            RingBuffer<MarketDataEvent> marketDataRingBuffer,
            MeterRegistry meterRegistry,
            Clock clock) {
        this.okHttpClient = okHttpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.marketDataRingBuffer = marketDataRingBuffer;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.symbols = properties.upperCaseSymbols();
    }

    @PostConstruct
    public void init() {
        connect();
    }

    @PreDestroy
    public void destroy() {
        shutdownRequested.set(true);
        reconnectScheduler.shutdownNow();
        if (webSocket != null) {
            webSocket.close(1000, "Application shutting down");
        }
        log.info("[Binance WS] 종료 완료");
    }

    public void connect() {
        String url = properties.buildCombinedStreamUrl();
        log.info("[Binance WS] 연결 시도: {} (symbols={})", url, symbols);

        Request request = new Request.Builder()
                .url(url)
                .build();
        webSocket = okHttpClient.newWebSocket(request, new StreamListener());
    }

    public boolean isConnected() {
        return connected.get();
    }

    @Override
    public Health health() {
        Health.Builder builder = connected.get() ? Health.up() : Health.down();
        long last = lastMessageAt.get();
        return builder
                .withDetail("symbols", symbols)
                .withDetail("reconnectAttempts", reconnectCount.get())
                .withDetail("lastMessageAgeMs", last == 0 ? -1 : clock.millis() - last)
                .build();
    }

    /**
     * @return true when the message was published onto the ring buffer
     */
    boolean routeMessage(String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (IOException e) {
            log.error("[Binance WS] 메시지 JSON 파싱 실패: {}", text, e);
            return dropped("malformed");
        }

        if (!root.has("stream") || !root.has("data")) {
            log.debug("[Binance WS] 알 수 없는 메시지 형식: {}", text);
            return dropped("unwrapped");
        }

        String streamName = root.get("stream").asText();
        EventType eventType = EventType.fromStream(streamName);
        if (eventType == EventType.UNKNOWN) {
            log.debug("[Binance WS] 미지원 스트림: {}", streamName);
            return dropped("unknown_stream");
        }

        String symbol = symbolOf(streamName);
        if (!symbols.contains(symbol)) {
            log.debug("[Binance WS] 미설정 심볼 무시: {}", symbol);
            return dropped("unsupported_symbol");
        }

        String dataJson = root.get("data").toString();
        marketDataRingBuffer.publishEvent((event, sequence) -> {
            event.clear();
            event.setType(eventType);
            event.setSymbol(symbol);
            event.setRawJson(dataJson);
            event.setIngestNanoTime(System.nanoTime());
        });
        lastMessageAt.set(clock.millis());
        Counter.builder("heatmap.stream.messages")
                .tag("type", eventType.name())
                .register(meterRegistry)
                .increment();

        log.trace("[Binance WS] RingBuffer publish: type={}, symbol={}, seq={}",
                eventType, symbol, marketDataRingBuffer.getCursor());
        return true;
    }

    private boolean dropped(String reason) {
        Counter.builder("heatmap.stream.dropped")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
        return false;
    }

    private void scheduleReconnect() {
        if (shutdownRequested.get()) return;

        int attempt = reconnectCount.incrementAndGet();
        int maxAttempts = properties.getMaxReconnectAttempts();
        if (maxAttempts > 0 && attempt > maxAttempts) {
            log.error("[Binance WS] 최대 재연결 횟수 초과 ({}회). 재연결 중단. 반응형 클러스터는 더 이상 갱신되지 않음", maxAttempts);
            return;
        }

        long delay = Math.min(properties.getReconnectIntervalMs() * attempt, MAX_RECONNECT_DELAY_MS);
        log.info("[Binance WS] {}ms 후 재연결 시도 ({}회차)", delay, attempt);
        reconnectScheduler.schedule(() -> {
            if (!shutdownRequested.get() && !connected.get()) {
                connect();
            }
        }, delay, TimeUnit.MILLISECONDS);
    }

    private static String symbolOf(String streamName) {
        int atIndex = streamName.indexOf('@');
        return (atIndex > 0 ? streamName.substring(0, atIndex) : streamName).toUpperCase();
    }

    private class StreamListener extends WebSocketListener {

        @Override
        public void onOpen(@NotNull WebSocket ws, @NotNull Response response) {
            connected.set(true);
            reconnectCount.set(0);
            log.info("[Binance WS] 연결 성공 (code={})", response.code());
        }

        @Override
        public void onMessage(@NotNull WebSocket ws, @NotNull String text) {
            routeMessage(text);
        }

        @Override
        public void onClosing(@NotNull WebSocket ws, int code, @NotNull String reason) {
            log.info("[Binance WS] 서버 연결 종료 요청 (code={}, reason={})", code, reason);
            ws.close(code, reason);
        }

        @Override
        public void onClosed(@NotNull WebSocket ws, int code, @NotNull String reason) {
            connected.set(false);
            log.info("[Binance WS] 연결 종료 (code={}, reason={})", code, reason);
            scheduleReconnect();
        }

        @Override
        public void onFailure(@NotNull WebSocket ws, @NotNull Throwable t, @Nullable Response response) {
            connected.set(false);
            log.error("[Binance WS] 연결 실패: {}", t.getMessage(), t);
            scheduleReconnect();
        }
    }
}
