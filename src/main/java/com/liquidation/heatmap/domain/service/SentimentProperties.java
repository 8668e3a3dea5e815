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
@ConfigurationProperties(prefix = "heatmap.sentiment")
public class SentimentProperties {

    private double baseDeviation = 0.20;
    private double highMultiplier = 1.5;

    @PostConstruct
    public void validate() {
        if (baseDeviation <= 0 || baseDeviation >= 1) {
            throw new InvalidConfigurationException("heatmap.sentiment.base-deviation must be within (0, 1)");
        }
        if (highMultiplier < 1) {
            throw new InvalidConfigurationException("heatmap.sentiment.high-multiplier must be at least 1");
        }
    }
}
