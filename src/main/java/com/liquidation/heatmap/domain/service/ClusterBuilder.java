package com.liquidation.heatmap.domain.service;

import com.liquidation.heatmap.domain.model.Cluster;
import com.liquidation.heatmap.domain.model.ClusterMode;
import com.liquidation.heatmap.domain.model.LiquidationLevel;
import com.liquidation.heatmap.domain.model.PositionSide;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Slf4j
@Service
public class ClusterBuilder {

    private static final MathContext MC = new MathContext(12, RoundingMode.HALF_UP);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private static final Comparator<LiquidationLevel> PRICE_ORDER = Comparator
            .comparing(LiquidationLevel::price)
            .thenComparing(LiquidationLevel::side)
            .thenComparing(level -> level.source().key());

    public static final Comparator<Cluster> STRENGTH_ORDER = Comparator
            .comparingDouble(Cluster::getStrength).reversed()
            .thenComparingDouble(Cluster::getDistancePercent)
            .thenComparing(Cluster::getPrice);

    public List<Cluster> build(
            String symbol,
            ClusterMode mode,
            List<LiquidationLevel> levels,
            BigDecimal referencePrice,
            BucketingRules rules) {

        if (levels == null || levels.isEmpty()) return List.of();

        double totalNotional = levels.stream().mapToDouble(LiquidationLevel::notional).sum();
        BigDecimal width = BigDecimal.valueOf(rules.bucketWidthPct());

        List<Bucket> buckets = new ArrayList<>();
        Bucket current = null;
        for (LiquidationLevel level : levels.stream().sorted(PRICE_ORDER).toList()) {
            if (current == null || !current.accepts(level.price(), width)) {
                current = new Bucket();
                buckets.add(current);
            }
            current.add(level);
        }

        List<Cluster> clusters = new ArrayList<>();
        int dropped = 0;
        for (int i = 0; i < buckets.size(); i++) {
            Bucket bucket = buckets.get(i);
            double share = totalNotional > 0 ? bucket.weight / totalNotional : 0.0;

            if (bucket.count < rules.minMembers() || share * 100 < rules.minWeightPct()) {
                dropped++;
                continue;
            }

            BigDecimal centroid = bucket.centroid();
            clusters.add(Cluster.builder()
                    .id(symbol + "-" + mode.name().charAt(0) + "-" + i)
                    .symbol(symbol)
                    .mode(mode)
                    .price(centroid)
                    .side(bucket.dominantSide())
                    .strength(strength(bucket.weight, totalNotional, rules.saturationK()))
                    .weight(bucket.weight)
                    .memberCount(bucket.count)
                    .distancePercent(distancePercent(centroid, referencePrice))
                    .lastUpdated(bucket.lastTimestamp)
                    .active(true)
                    .build());
        }

        clusters.sort(STRENGTH_ORDER);

        log.debug("[ClusterBuild] {} mode={} levels={} buckets={} kept={} dropped={} totalNotional={}",
                symbol, mode, levels.size(), buckets.size(), clusters.size(), dropped,
                String.format("%.2f", totalNotional));

        return clusters;
    }

    public static double strength(double bucketWeight, double totalWeight, double saturationK) {
        if (!(totalWeight > 0) || !(bucketWeight > 0)) return 0.0;
        double fraction = Math.min(1.0, bucketWeight / totalWeight);
        return Math.min(1.0, Math.sqrt(fraction * saturationK));
    }

    public static double distancePercent(BigDecimal price, BigDecimal referencePrice) {
        return price.subtract(referencePrice).abs()
                .divide(referencePrice, MC)
                .multiply(HUNDRED, MC)
                .doubleValue();
    }

    private static final class Bucket {

        private BigDecimal weightedPriceSum = BigDecimal.ZERO;
        private BigDecimal priceSum = BigDecimal.ZERO;
        private double weight;
        private double longWeight;
        private double shortWeight;
        private int count;
        private long lastTimestamp;

        void add(LiquidationLevel level) {
            weightedPriceSum = weightedPriceSum.add(level.price().multiply(BigDecimal.valueOf(level.weight()), MC), MC);
            priceSum = priceSum.add(level.price(), MC);
            weight += level.weight();
            if (level.side() == PositionSide.LONG) {
                longWeight += level.weight();
            } else {
                shortWeight += level.weight();
            }
            count++;
            lastTimestamp = Math.max(lastTimestamp, level.timestamp());
        }

        boolean accepts(BigDecimal price, BigDecimal widthPct) {
            BigDecimal centroid = centroid();
            BigDecimal deviationPct = price.subtract(centroid).abs()
                    .divide(centroid, MC)
                    .multiply(HUNDRED, MC);
            return deviationPct.compareTo(widthPct) <= 0;
        }

        BigDecimal centroid() {
            if (weight > 0) {
                return weightedPriceSum.divide(BigDecimal.valueOf(weight), MC);
            }
            return priceSum.divide(BigDecimal.valueOf(count), MC);
        }

        PositionSide dominantSide() {
            return longWeight > shortWeight ? PositionSide.LONG : PositionSide.SHORT;
        }
    }
}
