package com.liquidation.heatmap.domain.service;

import com.liquidation.heatmap.domain.exception.DataUnavailableException;
import com.liquidation.heatmap.domain.model.Cluster;
import com.liquidation.heatmap.domain.model.ClusterMode;
import com.liquidation.heatmap.domain.model.PositionSide;
import com.liquidation.heatmap.domain.model.Signal;
import com.liquidation.heatmap.domain.model.SignalDirection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SignalGeneratorTest {

    private static final BigDecimal PRICE = new BigDecimal("100");
    private static final SignalThresholds DEFAULTS = new SignalThresholds(0.6, 3.0, 0.5, 1.5, 0.5);

    private final SignalGenerator generator = new SignalGenerator();

    @Nested
    @DisplayName("LONG signals")
    class LongSignals {

        @Test
        @DisplayName("strong short cluster 2% above → LONG with stop 1.5% below and target past the cluster")
        void strongShortClusterAbove() {
            Cluster cluster = cluster("c1", "102", PositionSide.SHORT, 1.0);

            Signal signal = generator.generate("BTCUSDT", PRICE, List.of(cluster), DEFAULTS);

            assertEquals(SignalDirection.LONG, signal.getDirection());
            assertEquals(0, PRICE.compareTo(signal.getEntry()));
            assertEquals(0, new BigDecimal("98.5").compareTo(signal.getStopLoss()));
            assertEquals(0, new BigDecimal("102.51").compareTo(signal.getTakeProfit()));
            assertEquals(0, new BigDecimal("1.6733").compareTo(signal.getRiskReward()));
            assertEquals(1.0, signal.getConfidence());
            assertEquals("c1", signal.getSourceClusterId());
            assertSame(cluster, signal.getSourceCluster());
            assertTrue(signal.getStopLoss().compareTo(signal.getEntry()) < 0);
            assertTrue(signal.getEntry().compareTo(signal.getTakeProfit()) < 0);
        }

        @Test
        @DisplayName("take-profit 0.7% away passes a 0.5% minimum")
        void nearbyClusterPasses() {
            Signal signal = generator.generate("BTCUSDT", PRICE,
                    List.of(cluster("c1", "100.2", PositionSide.SHORT, 0.9)), DEFAULTS);

            assertEquals(SignalDirection.LONG, signal.getDirection());
            assertEquals(0, new BigDecimal("100.701").compareTo(signal.getTakeProfit()));
            assertEquals(0.9, signal.getConfidence());
        }

        @Test
        @DisplayName("take-profit landing exactly on the minimum is accepted")
        void exactMinimumAccepted() {
            SignalThresholds exact = new SignalThresholds(0.6, 3.0, 0.701, 1.5, 0.5);
            Signal signal = generator.generate("BTCUSDT", PRICE,
                    List.of(cluster("c1", "100.2", PositionSide.SHORT, 0.9)), exact);
            assertEquals(SignalDirection.LONG, signal.getDirection());

            SignalThresholds noOffset = new SignalThresholds(0.6, 3.0, 0.5, 1.5, 0.0);
            Signal atCluster = generator.generate("BTCUSDT", PRICE,
                    List.of(cluster("c2", "100.5", PositionSide.SHORT, 0.9)), noOffset);
            assertEquals(SignalDirection.LONG, atCluster.getDirection());
            assertEquals(0, new BigDecimal("100.5").compareTo(atCluster.getTakeProfit()));
        }

        @Test
        @DisplayName("strength ties resolve to the nearer cluster")
        void strengthTieBreaksOnDistance() {
            Signal signal = generator.generate("BTCUSDT", PRICE, List.of(
                    cluster("far", "102", PositionSide.SHORT, 0.8),
                    cluster("near", "101.5", PositionSide.SHORT, 0.8)), DEFAULTS);

            assertEquals("near", signal.getSourceClusterId());
        }

        @Test
        @DisplayName("stronger cluster wins over a nearer one")
        void strengthFirst() {
            Signal signal = generator.generate("BTCUSDT", PRICE, List.of(
                    cluster("near", "101", PositionSide.SHORT, 0.7),
                    cluster("strong", "102.5", PositionSide.SHORT, 0.95)), DEFAULTS);

            assertEquals("strong", signal.getSourceClusterId());
        }

        @Test
        @DisplayName("candidate failing the take-profit check falls through to the next one")
        void fallthrough() {
            SignalThresholds noOffset = new SignalThresholds(0.6, 3.0, 0.5, 1.5, 0.0);
            Signal signal = generator.generate("BTCUSDT", PRICE, List.of(
                    cluster("tooClose", "100.1", PositionSide.SHORT, 1.0),
                    cluster("fallback", "101", PositionSide.SHORT, 0.8)), noOffset);

            assertEquals("fallback", signal.getSourceClusterId());
            assertEquals(0.8, signal.getConfidence());
        }
    }

    @Nested
    @DisplayName("SHORT signals")
    class ShortSignals {

        @Test
        @DisplayName("strong long cluster below → SHORT with mirrored stop and target")
        void strongLongClusterBelow() {
            Signal signal = generator.generate("BTCUSDT", PRICE,
                    List.of(cluster("c1", "98", PositionSide.LONG, 0.8)), DEFAULTS);

            assertEquals(SignalDirection.SHORT, signal.getDirection());
            assertEquals(0, new BigDecimal("101.5").compareTo(signal.getStopLoss()));
            assertEquals(0, new BigDecimal("97.51").compareTo(signal.getTakeProfit()));
            assertTrue(signal.getTakeProfit().compareTo(signal.getEntry()) < 0);
            assertTrue(signal.getEntry().compareTo(signal.getStopLoss()) < 0);
        }

        @Test
        @DisplayName("LONG is preferred when both sides qualify")
        void longFirst() {
            Signal signal = generator.generate("BTCUSDT", PRICE, List.of(
                    cluster("below", "98", PositionSide.LONG, 1.0),
                    cluster("above", "102", PositionSide.SHORT, 0.7)), DEFAULTS);

            assertEquals(SignalDirection.LONG, signal.getDirection());
            assertEquals("above", signal.getSourceClusterId());
        }
    }

    @Nested
    @DisplayName("NEUTRAL")
    class Neutral {

        @Test
        @DisplayName("no cluster passes the filters → NEUTRAL with null levels and zero confidence")
        void noCandidates() {
            Signal signal = generator.generate("BTCUSDT", PRICE, List.of(
                    cluster("weak", "101", PositionSide.SHORT, 0.3),
                    cluster("far", "110", PositionSide.SHORT, 1.0),
                    cluster("wrongSide", "102", PositionSide.LONG, 1.0)), DEFAULTS);

            assertTrue(signal.isNeutral());
            assertEquals(0.0, signal.getConfidence());
            assertNull(signal.getEntry());
            assertNull(signal.getStopLoss());
            assertNull(signal.getTakeProfit());
            assertNull(signal.getRiskReward());
            assertNotNull(signal.getReason());
        }

        @Test
        @DisplayName("every candidate too close for the minimum take-profit → NEUTRAL")
        void allFailTakeProfit() {
            SignalThresholds strict = new SignalThresholds(0.6, 3.0, 5.0, 1.5, 0.5);
            Signal signal = generator.generate("BTCUSDT", PRICE, List.of(
                    cluster("a", "101", PositionSide.SHORT, 0.9),
                    cluster("b", "99", PositionSide.LONG, 0.9)), strict);

            assertTrue(signal.isNeutral());
            assertTrue(signal.getReason().contains("take-profit"));
        }

        @Test
        @DisplayName("inactive clusters are never candidates")
        void inactiveIgnored() {
            Signal signal = generator.generate("BTCUSDT", PRICE,
                    List.of(cluster("c1", "102", PositionSide.SHORT, 1.0).deactivated()), DEFAULTS);

            assertTrue(signal.isNeutral());
        }

        @Test
        @DisplayName("empty cluster list → NEUTRAL")
        void empty() {
            assertTrue(generator.generate("BTCUSDT", PRICE, List.of(), DEFAULTS).isNeutral());
        }
    }

    @Nested
    @DisplayName("filters and preconditions")
    class Filters {

        @Test
        @DisplayName("strength and distance bounds are inclusive")
        void inclusiveBounds() {
            Signal signal = generator.generate("BTCUSDT", PRICE,
                    List.of(cluster("edge", "103", PositionSide.SHORT, 0.6)), DEFAULTS);

            assertEquals(SignalDirection.LONG, signal.getDirection());
        }

        @Test
        @DisplayName("distance is measured from the entry price, not the stored distance")
        void distanceFromEntry() {
            Cluster stale = cluster("c1", "102", PositionSide.SHORT, 1.0).toBuilder()
                    .distancePercent(0.1)
                    .build();

            Signal signal = generator.generate("BTCUSDT", new BigDecimal("90"), List.of(stale), DEFAULTS);
            assertTrue(signal.isNeutral());
        }

        @Test
        @DisplayName("missing or non-positive price → DataUnavailableException")
        void missingPrice() {
            List<Cluster> clusters = List.of(cluster("c1", "102", PositionSide.SHORT, 1.0));
            assertThrows(DataUnavailableException.class,
                    () -> generator.generate("BTCUSDT", null, clusters, DEFAULTS));
            assertThrows(DataUnavailableException.class,
                    () -> generator.generate("BTCUSDT", BigDecimal.ZERO, clusters, DEFAULTS));
        }

        @Test
        @DisplayName("same input → same signal")
        void deterministic() {
            List<Cluster> clusters = List.of(
                    cluster("a", "101.5", PositionSide.SHORT, 0.8),
                    cluster("b", "98.5", PositionSide.LONG, 0.8));

            assertEquals(generator.generate("BTCUSDT", PRICE, clusters, DEFAULTS),
                    generator.generate("BTCUSDT", PRICE, clusters, DEFAULTS));
        }
    }

    private Cluster cluster(String id, String price, PositionSide side, double strength) {
        BigDecimal p = new BigDecimal(price);
        return Cluster.builder()
                .id(id)
                .symbol("BTCUSDT")
                .mode(ClusterMode.PREDICTIVE)
                .price(p)
                .side(side)
                .strength(strength)
                .weight(strength * 1000)
                .memberCount(1)
                .distancePercent(ClusterBuilder.distancePercent(p, PRICE))
                .lastUpdated(1_000L)
                .active(true)
                .build();
    }
}
