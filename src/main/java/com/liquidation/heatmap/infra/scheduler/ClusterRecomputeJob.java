package com.liquidation.heatmap.infra.scheduler;

import com.liquidation.heatmap.domain.model.ClusterMode;
import com.liquidation.heatmap.domain.service.ClusterProperties;
import com.liquidation.heatmap.domain.service.LiquidationHeatmapService;
import com.liquidation.heatmap.domain.service.MarketDataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Rebuilds cluster generations on a fixed cadence, independent of requests and event arrival.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClusterRecomputeJob {

    private final LiquidationHeatmapService heatmapService;
    private final MarketDataSource marketDataSource;
    private final ClusterProperties clusterProperties;

    @Scheduled(
            initialDelayString = "${heatmap.cluster.predictive.recompute-interval-ms:5000}",
            fixedDelayString = "${heatmap.cluster.predictive.recompute-interval-ms:5000}")
    public void recomputePredictive() {
        recomputeAll(ClusterMode.PREDICTIVE);
    }

    @Scheduled(
            initialDelayString = "${heatmap.cluster.reactive.rebuild-interval-ms:5000}",
            fixedDelayString = "${heatmap.cluster.reactive.rebuild-interval-ms:5000}")
    public void recomputeReactive() {
        recomputeAll(ClusterMode.REACTIVE);
    }

    void recomputeAll(ClusterMode mode) {
        if (!clusterProperties.isEnabled(mode)) return;

        int failed = 0;
        for (String symbol : marketDataSource.supportedSymbols()) {
            try {
                heatmapService.recompute(symbol, mode);
            } catch (RuntimeException e) {
                failed++;
                log.warn("[Recompute] {} {} 재계산 실패: {}", symbol, mode, e.getMessage());
            }
        }
        if (failed > 0) {
            log.warn("[Recompute] {} 사이클 완료: 실패 {}건", mode, failed);
        }
    }
}
