package com.liquidation.heatmap.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

@Getter
@Builder
@ToString
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LiquidationEvent {

    private final String eventId;
    private final String symbol;
    private final PositionSide side;
    private final BigDecimal price;
    private final BigDecimal notional;
    private final long timestamp;

    public boolean isValid() {
        return symbol != null
                && side != null
                && price != null && price.signum() > 0
                && notional != null && notional.signum() > 0;
    }
}
