package com.liquidation.heatmap.domain.service;

import com.liquidation.heatmap.domain.exception.DataUnavailableException;
import com.liquidation.heatmap.domain.model.Cluster;
import com.liquidation.heatmap.domain.model.PositionSide;
import com.liquidation.heatmap.domain.model.Signal;
import com.liquidation.heatmap.domain.model.SignalDirection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class SignalGenerator {

    private static final MathContext MC = new MathContext(12, RoundingMode.HALF_UP);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int RISK_REWARD_SCALE = 4;

    /** When both sides qualify, LONG wins. */
    public static final List<SignalDirection> LONG_FIRST = List.of(SignalDirection.LONG, SignalDirection.SHORT);

    private static final Comparator<Candidate> CANDIDATE_ORDER = Comparator
            .comparingDouble((Candidate c) -> c.cluster().getStrength()).reversed()
            .thenComparingDouble(Candidate::distancePercent)
            .thenComparing(c -> c.cluster().getPrice());

    public Signal generate(String symbol, BigDecimal currentPrice, List<Cluster> clusters, SignalThresholds thresholds) {
        if (currentPrice == null || currentPrice.signum() <= 0) {
            throw new DataUnavailableException("current price unavailable for " + symbol);
        }

        int rejectedByTakeProfit = 0;
        for (SignalDirection direction : LONG_FIRST) {
            List<Candidate> candidates = candidates(direction, currentPrice, clusters, thresholds);
            for (Candidate candidate : candidates) {
                Optional<Signal> signal = build(symbol, direction, currentPrice, candidate, thresholds);
                if (signal.isPresent()) {
                    log.info("[Signal] {} {} entry={} sl={} tp={} rr={} cluster={}",
                            symbol, direction, currentPrice.toPlainString(),
                            signal.get().getStopLoss().toPlainString(), signal.get().getTakeProfit().toPlainString(),
                            signal.get().getRiskReward(), candidate.cluster().getId());
                    return signal.get();
                }
                rejectedByTakeProfit++;
            }
        }

        String reason = rejectedByTakeProfit > 0
                ? "Candidate clusters too close for minimum take-profit (" + rejectedByTakeProfit + " rejected)"
                : "No strong liquidation cluster within range";
        log.debug("[Signal] {} NEUTRAL: {}", symbol, reason);
        return Signal.neutral(symbol, reason);
    }

    private List<Candidate> candidates(
            SignalDirection direction, BigDecimal price, List<Cluster> clusters, SignalThresholds thresholds) {

        PositionSide wantedSide = direction == SignalDirection.LONG ? PositionSide.SHORT : PositionSide.LONG;
        return clusters.stream()
                .filter(Cluster::isActive)
                .filter(c -> c.getSide() == wantedSide)
                .filter(c -> direction == SignalDirection.LONG ? c.isAbove(price) : c.isBelow(price))
                .filter(c -> c.getStrength() >= thresholds.minStrength())
                .map(c -> new Candidate(c, ClusterBuilder.distancePercent(c.getPrice(), price)))
                .filter(c -> c.distancePercent() <= thresholds.maxDistancePct())
                .sorted(CANDIDATE_ORDER)
                .toList();
    }

    private Optional<Signal> build(
            String symbol, SignalDirection direction, BigDecimal entry, Candidate candidate, SignalThresholds thresholds) {

        Cluster cluster = candidate.cluster();
        BigDecimal stopFraction = BigDecimal.valueOf(thresholds.stopLossPct()).divide(HUNDRED, MC);
        BigDecimal offsetFraction = BigDecimal.valueOf(thresholds.takeProfitOffsetPct()).divide(HUNDRED, MC);

        BigDecimal stopLoss;
        BigDecimal takeProfit;
        if (direction == SignalDirection.LONG) {
            stopLoss = entry.multiply(BigDecimal.ONE.subtract(stopFraction), MC);
            takeProfit = cluster.getPrice().multiply(BigDecimal.ONE.add(offsetFraction), MC);
        } else {
            stopLoss = entry.multiply(BigDecimal.ONE.add(stopFraction), MC);
            takeProfit = cluster.getPrice().multiply(BigDecimal.ONE.subtract(offsetFraction), MC);
        }

        BigDecimal reward = takeProfit.subtract(entry).abs();
        BigDecimal risk = entry.subtract(stopLoss).abs();
        BigDecimal takeProfitPct = reward.divide(entry, MC).multiply(HUNDRED, MC);

        if (takeProfitPct.compareTo(BigDecimal.valueOf(thresholds.minTakeProfitPct())) < 0) {
            log.debug("[Signal] {} {} 후보 제외: cluster={} tp%={} < min={}",
                    symbol, direction, cluster.getId(), takeProfitPct.toPlainString(), thresholds.minTakeProfitPct());
            return Optional.empty();
        }

        BigDecimal riskReward = risk.signum() == 0
                ? BigDecimal.ZERO.setScale(RISK_REWARD_SCALE)
                : reward.divide(risk, RISK_REWARD_SCALE, RoundingMode.HALF_UP);

        String sideLabel = cluster.getSide() == PositionSide.SHORT ? "short" : "long";
        return Optional.of(Signal.builder()
                .symbol(symbol)
                .direction(direction)
                .entry(entry)
                .stopLoss(stopLoss)
                .takeProfit(takeProfit)
                .confidence(cluster.getStrength())
                .riskReward(riskReward)
                .sourceClusterId(cluster.getId())
                .sourceCluster(cluster)
                .reason(String.format("Strong %s liquidation cluster at %s (strength %.2f, %.2f%% away)",
                        sideLabel, cluster.getPrice().round(MC).toPlainString(),
                        cluster.getStrength(), candidate.distancePercent()))
                .build());
    }

    private record Candidate(Cluster cluster, double distancePercent) {
    }
}
