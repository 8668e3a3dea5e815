package com.liquidation.heatmap.domain.model;

public enum ClusterMode {

    PREDICTIVE,
    REACTIVE;

    public static ClusterMode fromParam(String value, ClusterMode fallback) {
        if (value == null || value.isBlank()) return fallback;
        return ClusterMode.valueOf(value.trim().toUpperCase());
    }
}
