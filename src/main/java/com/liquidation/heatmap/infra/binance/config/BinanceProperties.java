package com.liquidation.heatmap.infra.binance.config;

import com.liquidation.heatmap.domain.exception.InvalidConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "binance")
public class BinanceProperties {

    private String restBaseUrl = "https://fapi.binance.com";

    private String wsBaseUrl = "wss://fstream.binance.com";

    private List<String> symbols = List.of("btcusdt", "ethusdt");

    private List<String> streams = List.of("forceOrder", "markPrice");

    private boolean streamEnabled = true;

    private int markPriceSpeed = 1000;

    private int depthLimit = 100;

    private long restCallTimeoutMs = 5000;

    private long reconnectIntervalMs = 5000;

    private int maxReconnectAttempts = 0;

    public Set<String> upperCaseSymbols() {
        Set<String> result = new LinkedHashSet<>();
        for (String symbol : symbols) {
            result.add(symbol.trim().toUpperCase());
        }
        return result;
    }

    public String buildCombinedStreamUrl() {
        StringBuilder sb = new StringBuilder(wsBaseUrl).append("/stream?streams=");
        List<String> streamPaths = symbols.stream()
                .flatMap(symbol -> streams.stream()
                        .map(stream -> buildStreamName(symbol, stream)))
                .toList();
        sb.append(String.join("/", streamPaths));
        return sb.toString();
    }

    private String buildStreamName(String symbol, String stream) {
        if ("markPrice".equals(stream)) {
            String speed = markPriceSpeed == 1000 ? "@1s" : "";
            return symbol.toLowerCase() + "@markPrice" + speed;
        }
        return symbol.toLowerCase() + "@" + stream;
    }

    @PostConstruct
    public void validate() {
        if (symbols == null || symbols.isEmpty()) {
            throw new InvalidConfigurationException("binance.symbols must not be empty");
        }
        if (depthLimit <= 0) {
            throw new InvalidConfigurationException("binance.depth-limit must be positive: " + depthLimit);
        }
        if (restCallTimeoutMs <= 0) {
            throw new InvalidConfigurationException("binance.rest-call-timeout-ms must be positive");
        }
    }
}
