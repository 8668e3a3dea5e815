package com.liquidation.heatmap.domain.service;

import com.liquidation.heatmap.domain.model.LevelSource;
import com.liquidation.heatmap.domain.model.LiquidationEvent;
import com.liquidation.heatmap.domain.model.LiquidationLevel;
import com.liquidation.heatmap.domain.model.OpenInterestSnapshot;
import com.liquidation.heatmap.domain.model.PositionSide;
import com.liquidation.heatmap.domain.model.PriceSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class LevelDistributor {

    private final LiquidationPriceCalculator liquidationPriceCalculator;
    private final ClusterProperties clusterProperties;

    public List<LiquidationLevel> distribute(PriceSnapshot price, OpenInterestSnapshot oi) {
        Map<Integer, Double> tierWeights = getTierWeights();
        double longOi = oi.longOi().doubleValue();
        double shortOi = oi.shortOi().doubleValue();

        List<LiquidationLevel> levels = new ArrayList<>(tierWeights.size() * 2);
        for (Map.Entry<Integer, Double> entry : tierWeights.entrySet()) {
            int leverage = entry.getKey();
            double weight = entry.getValue();
            LevelSource source = new LevelSource.LeverageTier(leverage);

            BigDecimal longLiqPrice = liquidationPriceCalculator.calculateLongLiquidationPrice(price.price(), leverage);
            BigDecimal shortLiqPrice = liquidationPriceCalculator.calculateShortLiquidationPrice(price.price(), leverage);
            double longNotional = longOi * weight;
            double shortNotional = shortOi * weight;

            levels.add(new LiquidationLevel(price.symbol(), longLiqPrice, PositionSide.LONG, source,
                    longNotional, longNotional, price.timestamp()));
            levels.add(new LiquidationLevel(price.symbol(), shortLiqPrice, PositionSide.SHORT, source,
                    shortNotional, shortNotional, price.timestamp()));

            log.debug("[LevelDist] {} lev={}x long={} short={} weight={}%",
                    price.symbol(), leverage, longLiqPrice.toPlainString(), shortLiqPrice.toPlainString(),
                    String.format("%.2f", weight * 100));
        }
        return levels;
    }

    /** Future-stamped events are treated as happening at {@code nowMs}. */
    public List<LiquidationLevel> fromEvents(List<LiquidationEvent> events, long nowMs) {
        long halfLifeMs = clusterProperties.getReactive().getDecayHalfLifeMs();
        List<LiquidationLevel> levels = new ArrayList<>(events.size());
        for (LiquidationEvent event : events) {
            if (!event.isValid()) continue;
            double notional = event.getNotional().doubleValue();
            double weight = notional * decayFactor(nowMs - event.getTimestamp(), halfLifeMs);
            levels.add(new LiquidationLevel(
                    event.getSymbol(),
                    event.getPrice(),
                    event.getSide(),
                    new LevelSource.RawEvent(event.getEventId()),
                    notional,
                    weight,
                    Math.min(event.getTimestamp(), nowMs)));
        }
        return levels;
    }

    public Map<Integer, Double> getTierWeights() {
        List<Integer> tiers = clusterProperties.getPredictive().getLeverageTiers();
        double exponent = clusterProperties.getPredictive().getTierWeightExponent();

        Map<Integer, Double> raw = new LinkedHashMap<>();
        double total = 0;
        for (int leverage : tiers) {
            double w = 1.0 / Math.pow(leverage, exponent);
            raw.put(leverage, w);
            total += w;
        }
        if (total > 0) {
            final double sum = total;
            raw.replaceAll((k, v) -> v / sum);
        }
        return raw;
    }

    static double decayFactor(long ageMs, long halfLifeMs) {
        long age = Math.max(0L, ageMs);
        return Math.exp(-(double) age / halfLifeMs);
    }
}
