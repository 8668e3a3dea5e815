package com.liquidation.heatmap.domain.service.refresh;

import com.liquidation.heatmap.domain.exception.InvalidConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "heatmap.refresh")
public class RefreshProperties {

    private long priceTtlMs = 5_000;
    private long openInterestTtlMs = 15_000;
    private long orderBookTtlMs = 15_000;
    private long clusterTtlMs = 5_000;
    private double jitterFraction = 0.1;
    private long staleCeilingMs = 60_000;
    private double rateLimitPerSecond = 10;
    private int rateLimitBurst = 10;
    private long callTimeoutMs = 3_000;
    private int maxRetries = 1;
    private int ioThreads = 4;
    private int batchThreads = 4;

    public long ttlFor(DataKind kind) {
        return switch (kind) {
            case PRICE -> priceTtlMs;
            case OPEN_INTEREST -> openInterestTtlMs;
            case ORDER_BOOK -> orderBookTtlMs;
            case PREDICTIVE_CLUSTERS, REACTIVE_CLUSTERS -> clusterTtlMs;
        };
    }

    @PostConstruct
    public void validate() {
        if (priceTtlMs <= 0 || openInterestTtlMs <= 0 || orderBookTtlMs <= 0 || clusterTtlMs <= 0) {
            throw new InvalidConfigurationException("heatmap.refresh TTLs must be positive");
        }
        if (jitterFraction < 0 || jitterFraction > 1) {
            throw new InvalidConfigurationException("heatmap.refresh.jitter-fraction must be within [0, 1]: " + jitterFraction);
        }
        if (staleCeilingMs <= 0) {
            throw new InvalidConfigurationException("heatmap.refresh.stale-ceiling-ms must be positive");
        }
        if (rateLimitPerSecond <= 0 || rateLimitBurst < 1) {
            throw new InvalidConfigurationException("heatmap.refresh rate limit must be positive with burst >= 1");
        }
        if (callTimeoutMs <= 0) {
            throw new InvalidConfigurationException("heatmap.refresh.call-timeout-ms must be positive");
        }
        if (maxRetries < 0 || maxRetries > 1) {
            throw new InvalidConfigurationException("heatmap.refresh.max-retries must be 0 or 1: " + maxRetries);
        }
        if (ioThreads < 1 || batchThreads < 1) {
            throw new InvalidConfigurationException("heatmap.refresh thread pools need at least one thread");
        }
    }
}
