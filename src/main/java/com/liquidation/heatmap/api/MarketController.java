package com.liquidation.heatmap.api;

import com.liquidation.heatmap.domain.exception.DataUnavailableException;
import com.liquidation.heatmap.domain.exception.UnsupportedSymbolException;
import com.liquidation.heatmap.domain.model.ClusterMode;
import com.liquidation.heatmap.domain.service.LiquidationHeatmapService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class MarketController {

    private final LiquidationHeatmapService heatmapService;

    @GetMapping("/levels/{symbol}")
    public ResponseEntity<Object> getLevels(
            @PathVariable String symbol,
            @RequestParam(required = false) String mode,
            @RequestParam(required = false) Double minStrength,
            @RequestParam(required = false) Double maxDistance) {

        try {
            ClusterMode clusterMode = ClusterMode.fromParam(mode, heatmapService.defaultMode());
            return ResponseEntity.ok(
                    heatmapService.getSupportResistance(symbol, clusterMode, minStrength, maxDistance));
        } catch (UnsupportedSymbolException | IllegalArgumentException e) {
            return ApiResponses.badRequest(symbol, e.getMessage());
        } catch (DataUnavailableException e) {
            log.warn("[Market API] {} 지지/저항 조회 불가: {}", symbol, e.getMessage());
            return ApiResponses.unavailable(symbol, e.getMessage());
        }
    }

    @GetMapping("/sentiment/{symbol}")
    public ResponseEntity<Object> getSentiment(@PathVariable String symbol) {
        try {
            return ResponseEntity.ok(heatmapService.getSentiment(symbol));
        } catch (UnsupportedSymbolException e) {
            return ApiResponses.badRequest(symbol, e.getMessage());
        }
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        return ResponseEntity.ok(heatmapService.getStats());
    }
}
