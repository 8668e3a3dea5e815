package com.liquidation.heatmap.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

@Getter
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
@JsonIgnoreProperties(ignoreUnknown = true)
public class Cluster {

    private final String id;
    private final String symbol;
    private final ClusterMode mode;
    private final BigDecimal price;
    private final PositionSide side;
    private final double strength;
    private final double weight;
    private final int memberCount;
    private final double distancePercent;
    private final long lastUpdated;
    private final boolean active;

    public boolean isAbove(BigDecimal referencePrice) {
        return price.compareTo(referencePrice) > 0;
    }

    public boolean isBelow(BigDecimal referencePrice) {
        return price.compareTo(referencePrice) < 0;
    }

    public Cluster deactivated() {
        return toBuilder().active(false).build();
    }
}
