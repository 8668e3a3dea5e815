package com.liquidation.heatmap.api;

import com.liquidation.heatmap.domain.exception.UnsupportedSymbolException;
import com.liquidation.heatmap.domain.model.ClusterMode;
import com.liquidation.heatmap.domain.model.SymbolSignalPayload;
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

import java.util.Arrays;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/signals")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class SignalController {

    private static final int MAX_BATCH_SYMBOLS = 50;

    private final LiquidationHeatmapService heatmapService;

    @GetMapping("/{symbol}")
    public ResponseEntity<Object> getSignal(
            @PathVariable String symbol,
            @RequestParam(required = false) String mode) {

        try {
            ClusterMode clusterMode = ClusterMode.fromParam(mode, heatmapService.defaultMode());
            String key = heatmapService.requireSupported(symbol);
            SymbolSignalPayload payload = heatmapService.getSignalPayload(key, clusterMode);
            return ResponseEntity.ok(payload);
        } catch (UnsupportedSymbolException | IllegalArgumentException e) {
            return ApiResponses.badRequest(symbol, e.getMessage());
        }
    }

    @GetMapping("/batch")
    public ResponseEntity<Object> getBatchSignals(
            @RequestParam(required = false) String symbols,
            @RequestParam(required = false) String mode) {

        ClusterMode clusterMode;
        try {
            clusterMode = ClusterMode.fromParam(mode, heatmapService.defaultMode());
        } catch (IllegalArgumentException e) {
            return ApiResponses.badRequest(null, e.getMessage());
        }

        List<String> requested = symbols == null || symbols.isBlank()
                ? List.of()
                : Arrays.stream(symbols.split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .map(String::toUpperCase)
                        .distinct()
                        .toList();

        if (requested.isEmpty()) {
            return ApiResponses.badRequest(null, "symbols parameter is required");
        }
        if (requested.size() > MAX_BATCH_SYMBOLS) {
            return ApiResponses.badRequest(null, "at most " + MAX_BATCH_SYMBOLS + " symbols per batch");
        }

        log.info("[Signal API] 배치 요청: symbols={}, mode={}", requested, clusterMode);
        List<SymbolSignalPayload> results = heatmapService.getBatchSignals(requested, clusterMode);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "mode", clusterMode,
                "count", results.size(),
                "results", results));
    }
}
