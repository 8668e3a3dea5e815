package com.liquidation.heatmap.api;

import com.liquidation.heatmap.domain.exception.DataUnavailableException;
import com.liquidation.heatmap.domain.exception.UnsupportedSymbolException;
import com.liquidation.heatmap.domain.model.ClusterGeneration;
import com.liquidation.heatmap.domain.model.ClusterMode;
import com.liquidation.heatmap.domain.service.LiquidationHeatmapService;
import com.liquidation.heatmap.domain.service.refresh.CachedValue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/clusters")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class ClusterController {

    private final LiquidationHeatmapService heatmapService;

    @GetMapping("/{symbol}")
    public ResponseEntity<Object> getClusters(
            @PathVariable String symbol,
            @RequestParam(required = false) String mode) {

        try {
            ClusterMode clusterMode = ClusterMode.fromParam(mode, heatmapService.defaultMode());
            CachedValue<ClusterGeneration> cached = heatmapService.getClusters(symbol, clusterMode);
            ClusterGeneration generation = cached.value();

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.put("symbol", generation.symbol());
            body.put("mode", generation.mode());
            body.put("generation", generation.generation());
            body.put("referencePrice", generation.referencePrice());
            body.put("timestamp", generation.timestamp());
            body.put("stale", generation.stale() || cached.stale());
            body.put("refreshFailed", cached.refreshFailed());
            body.put("count", generation.clusters().size());
            body.put("activeCount", generation.activeCount());
            body.put("clusters", generation.clusters());
            return ResponseEntity.ok(body);

        } catch (UnsupportedSymbolException | IllegalArgumentException e) {
            return ApiResponses.badRequest(symbol, e.getMessage());
        } catch (DataUnavailableException e) {
            log.warn("[Cluster API] {} 클러스터 데이터 없음: {}", symbol, e.getMessage());
            return ApiResponses.unavailable(symbol, e.getMessage());
        }
    }

    @GetMapping("/{symbol}/best")
    public ResponseEntity<Object> getBestCluster(
            @PathVariable String symbol,
            @RequestParam(required = false) String mode,
            @RequestParam(required = false) Double minStrength) {

        try {
            ClusterMode clusterMode = ClusterMode.fromParam(mode, heatmapService.defaultMode());
            return heatmapService.getBestCluster(symbol, clusterMode, minStrength)
                    .<ResponseEntity<Object>>map(cluster -> ResponseEntity.ok(Map.of(
                            "success", true,
                            "symbol", cluster.getSymbol(),
                            "mode", clusterMode,
                            "cluster", cluster)))
                    .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                            "success", false,
                            "symbol", symbol.toUpperCase(),
                            "message", "No active cluster above the requested strength")));

        } catch (UnsupportedSymbolException | IllegalArgumentException e) {
            return ApiResponses.badRequest(symbol, e.getMessage());
        } catch (DataUnavailableException e) {
            log.warn("[Cluster API] {} best 클러스터 조회 불가: {}", symbol, e.getMessage());
            return ApiResponses.unavailable(symbol, e.getMessage());
        }
    }
}
