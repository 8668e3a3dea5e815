package com.liquidation.heatmap.infra.binance.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

@Getter
@NoArgsConstructor
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class DepthResponse {

    private static final MathContext MC = new MathContext(12, RoundingMode.HALF_UP);

    private Long lastUpdateId;

    @JsonProperty("E")
    private Long messageOutputTime;

    @JsonProperty("T")
    private Long transactionTime;

    private List<List<String>> bids;

    private List<List<String>> asks;

    public BigDecimal bidNotional() {
        return notional(bids);
    }

    public BigDecimal askNotional() {
        return notional(asks);
    }

    private static BigDecimal notional(List<List<String>> levels) {
        if (levels == null) return BigDecimal.ZERO;
        BigDecimal total = BigDecimal.ZERO;
        for (List<String> level : levels) {
            if (level.size() < 2) continue;
            total = total.add(new BigDecimal(level.get(0)).multiply(new BigDecimal(level.get(1)), MC), MC);
        }
        return total;
    }
}
