package com.liquidation.heatmap.domain.model;

public interface Timestamped {

    long timestamp();
}
