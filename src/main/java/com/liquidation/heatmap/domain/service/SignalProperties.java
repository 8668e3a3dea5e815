package com.liquidation.heatmap.domain.service;

import com.liquidation.heatmap.domain.exception.InvalidConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "heatmap.signal")
public class SignalProperties {

    private double minStrength = 0.6;
    private double maxDistancePct = 3.0;
    private double minTakeProfitPct = 0.5;
    private double stopLossPct = 1.5;
    private double takeProfitOffsetPct = 0.5;

    public SignalThresholds thresholds() {
        return new SignalThresholds(minStrength, maxDistancePct, minTakeProfitPct, stopLossPct, takeProfitOffsetPct);
    }

    @PostConstruct
    public void validate() {
        if (minStrength < 0 || minStrength > 1) {
            throw new InvalidConfigurationException("heatmap.signal.min-strength must be within [0, 1]: " + minStrength);
        }
        if (maxDistancePct < 0) {
            throw new InvalidConfigurationException("heatmap.signal.max-distance-pct must not be negative");
        }
        if (minTakeProfitPct < 0) {
            throw new InvalidConfigurationException("heatmap.signal.min-take-profit-pct must not be negative");
        }
        if (stopLossPct <= 0 || stopLossPct >= 100) {
            throw new InvalidConfigurationException("heatmap.signal.stop-loss-pct must be within (0, 100): " + stopLossPct);
        }
        if (takeProfitOffsetPct < 0 || takeProfitOffsetPct >= 100) {
            throw new InvalidConfigurationException("heatmap.signal.take-profit-offset-pct must be within [0, 100)");
        }
    }
}
