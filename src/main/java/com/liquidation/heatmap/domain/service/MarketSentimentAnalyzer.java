package com.liquidation.heatmap.domain.service;

import com.liquidation.heatmap.domain.model.MarketSentiment;
import com.liquidation.heatmap.domain.model.MarketSentiment.Bias;
import com.liquidation.heatmap.domain.model.MarketSentiment.BiasStrength;
import com.liquidation.heatmap.domain.model.OpenInterestSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class MarketSentimentAnalyzer {

    private final SentimentProperties sentimentProperties;

    public MarketSentiment analyze(OpenInterestSnapshot oi) {
        if (oi == null || oi.totalOi().signum() == 0) {
            return MarketSentiment.unknown(oi == null ? null : oi.symbol());
        }

        double ratio = oi.longShortRatio();
        double deviation = sentimentProperties.getBaseDeviation();
        double highDeviation = deviation * sentimentProperties.getHighMultiplier();

        Bias bias;
        BiasStrength strength;
        String interpretation;
        if (ratio > 1 + deviation) {
            bias = Bias.BULLISH_BIAS;
            strength = ratio > 1 + highDeviation ? BiasStrength.HIGH : BiasStrength.MODERATE;
            interpretation = "Longs dominate open interest; long liquidations below price carry more fuel";
        } else if (ratio < 1 - deviation) {
            bias = Bias.BEARISH_BIAS;
            strength = ratio < 1 - highDeviation ? BiasStrength.HIGH : BiasStrength.MODERATE;
            interpretation = "Shorts dominate open interest; short squeezes above price carry more fuel";
        } else {
            bias = Bias.NEUTRAL;
            strength = BiasStrength.LOW;
            interpretation = "Open interest is balanced between longs and shorts";
        }

        log.debug("[Sentiment] {} ratio={} bias={} strength={}",
                oi.symbol(), String.format("%.3f", ratio), bias, strength);

        return new MarketSentiment(oi.symbol(), bias, strength, ratio,
                oi.totalOi(), oi.longOi(), oi.shortOi(), interpretation);
    }
}
