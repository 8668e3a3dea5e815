package com.liquidation.heatmap.infra.disruptor.config;

import com.liquidation.heatmap.domain.exception.InvalidConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "heatmap.ingest")
public class IngestProperties {

    public enum WaitStrategyType {
        /** Low CPU, a few hundred microseconds of latency. */
        SLEEPING,
        /** Spins on a core; lowest latency. */
        YIELDING,
        BLOCKING
    }

    private int ringBufferSize = 16_384;
    private WaitStrategyType waitStrategy = WaitStrategyType.SLEEPING;

    @PostConstruct
    public void validate() {
        if (ringBufferSize <= 0 || Integer.bitCount(ringBufferSize) != 1) {
            throw new InvalidConfigurationException(
                    "heatmap.ingest.ring-buffer-size must be a power of 2: " + ringBufferSize);
        }
        if (waitStrategy == null) {
            throw new InvalidConfigurationException("heatmap.ingest.wait-strategy must be set");
        }
    }
}
