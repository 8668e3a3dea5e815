package com.liquidation.heatmap.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

@Getter
@Builder
@ToString
@EqualsAndHashCode
@JsonIgnoreProperties(ignoreUnknown = true)
public class Signal {

    private final String symbol;
    private final SignalDirection direction;
    private final BigDecimal entry;
    private final BigDecimal stopLoss;
    private final BigDecimal takeProfit;
    private final double confidence;
    private final BigDecimal riskReward;
    private final String sourceClusterId;
    private final Cluster sourceCluster;
    private final String reason;

    public static Signal neutral(String symbol, String reason) {
        return Signal.builder()
                .symbol(symbol)
                .direction(SignalDirection.NEUTRAL)
                .confidence(0.0)
                .reason(reason)
                .build();
    }

    @JsonIgnore
    public boolean isNeutral() {
        return direction == SignalDirection.NEUTRAL;
    }
}
