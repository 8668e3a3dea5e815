package com.liquidation.heatmap.infra.binance.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;

@Getter
@NoArgsConstructor
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class ForceOrderEvent {

    @JsonProperty("e")
    private String eventType;

    @JsonProperty("E")
    private Long eventTime;

    @JsonProperty("o")
    private Order order;

    @Getter
    @NoArgsConstructor
    @ToString
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Order {

        @JsonProperty("s")
        private String symbol;

        /** SELL closes a liquidated long, BUY closes a liquidated short. */
        @JsonProperty("S")
        private String side;

        @JsonProperty("q")
        private BigDecimal originalQuantity;

        @JsonProperty("p")
        private BigDecimal price;

        @JsonProperty("ap")
        private BigDecimal averagePrice;

        @JsonProperty("X")
        private String orderStatus;

        @JsonProperty("z")
        private BigDecimal accumulatedFilledQuantity;

        @JsonProperty("T")
        private Long tradeTime;
    }
}
