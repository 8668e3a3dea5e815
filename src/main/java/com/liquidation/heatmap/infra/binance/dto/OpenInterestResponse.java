package com.liquidation.heatmap.infra.binance.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;

/** Open interest in contracts (base asset units), not quote notional. */
@Getter
@NoArgsConstructor
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class OpenInterestResponse {

    private String symbol;
    private BigDecimal openInterest;
    private Long time;
}
