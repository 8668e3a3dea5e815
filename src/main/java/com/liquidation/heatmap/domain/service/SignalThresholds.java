package com.liquidation.heatmap.domain.service;

public record SignalThresholds(
        double minStrength,
        double maxDistancePct,
        double minTakeProfitPct,
        double stopLossPct,
        double takeProfitOffsetPct
) {

    public SignalThresholds withFilters(Double minStrengthOverride, Double maxDistanceOverride) {
        return new SignalThresholds(
                minStrengthOverride != null ? minStrengthOverride : minStrength,
                maxDistanceOverride != null ? maxDistanceOverride : maxDistancePct,
                minTakeProfitPct,
                stopLossPct,
                takeProfitOffsetPct);
    }
}
