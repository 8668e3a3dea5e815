package com.liquidation.heatmap.api;

import com.liquidation.heatmap.domain.exception.DataUnavailableException;
import com.liquidation.heatmap.domain.model.Cluster;
import com.liquidation.heatmap.domain.model.ClusterGeneration;
import com.liquidation.heatmap.domain.model.ClusterMode;
import com.liquidation.heatmap.domain.model.PositionSide;
import com.liquidation.heatmap.domain.service.LiquidationHeatmapService;
import com.liquidation.heatmap.domain.service.refresh.CachedValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ClusterController.class)
class ClusterControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LiquidationHeatmapService heatmapService;

    private final Cluster cluster = Cluster.builder()
            .id("BTCUSDT-P-0")
            .symbol("BTCUSDT")
            .mode(ClusterMode.PREDICTIVE)
            .price(new BigDecimal("102"))
            .side(PositionSide.SHORT)
            .strength(0.8)
            .weight(1_000)
            .memberCount(3)
            .distancePercent(2.0)
            .lastUpdated(1_000L)
            .active(true)
            .build();

    @BeforeEach
    void setUp() {
        when(heatmapService.defaultMode()).thenReturn(ClusterMode.PREDICTIVE);
    }

    @Test
    @DisplayName("GET /api/clusters/{symbol} returns the latest generation")
    void clusters() throws Exception {
        ClusterGeneration generation = new ClusterGeneration("BTCUSDT", ClusterMode.PREDICTIVE, 4,
                new BigDecimal("100"), 1_000L, false, List.of(cluster, cluster.deactivated()));
        when(heatmapService.getClusters("BTCUSDT", ClusterMode.PREDICTIVE))
                .thenReturn(new CachedValue<>(generation, 1_000L, false, true));

        mockMvc.perform(get("/api/clusters/BTCUSDT"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.generation").value(4))
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.activeCount").value(1))
                .andExpect(jsonPath("$.refreshFailed").value(true))
                .andExpect(jsonPath("$.clusters[0].side").value("SHORT"))
                .andExpect(jsonPath("$.clusters[0].strength").value(0.8));
    }

    @Test
    @DisplayName("no data at all is 503")
    void unavailable() throws Exception {
        when(heatmapService.getClusters("BTCUSDT", ClusterMode.REACTIVE))
                .thenThrow(new DataUnavailableException("REACTIVE_CLUSTERS unavailable for BTCUSDT"));

        mockMvc.perform(get("/api/clusters/BTCUSDT").param("mode", "REACTIVE"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    @DisplayName("best cluster is returned, or 404 when none qualifies")
    void best() throws Exception {
        when(heatmapService.getBestCluster("BTCUSDT", ClusterMode.PREDICTIVE, 0.7)).thenReturn(Optional.of(cluster));
        when(heatmapService.getBestCluster("BTCUSDT", ClusterMode.PREDICTIVE, 0.9)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/clusters/BTCUSDT/best").param("minStrength", "0.7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cluster.id").value("BTCUSDT-P-0"));

        mockMvc.perform(get("/api/clusters/BTCUSDT/best").param("minStrength", "0.9"))
                .andExpect(status().isNotFound());
    }
}
