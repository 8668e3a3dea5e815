package com.liquidation.heatmap.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SymbolSignalPayload(
        String symbol,
        ClusterMode mode,
        BigDecimal price,
        Signal signal,
        List<Cluster> clusters,
        Long generation,
        boolean stale,
        boolean refreshFailed,
        long timestamp,
        String error
) {

    public static SymbolSignalPayload failed(String symbol, ClusterMode mode, String error, long timestamp) {
        return new SymbolSignalPayload(symbol, mode, null,
                Signal.neutral(symbol, error), List.of(), null, false, false, timestamp, error);
    }
}
