package com.liquidation.heatmap.domain.model;

public enum SignalDirection {
    LONG, SHORT, NEUTRAL
}
