package com.liquidation.heatmap.domain.service;

import com.liquidation.heatmap.domain.exception.DataUnavailableException;
import com.liquidation.heatmap.domain.exception.MarketDataException;
import com.liquidation.heatmap.domain.exception.UnsupportedSymbolException;
import com.liquidation.heatmap.domain.model.Cluster;
import com.liquidation.heatmap.domain.model.ClusterGeneration;
import com.liquidation.heatmap.domain.model.ClusterMode;
import com.liquidation.heatmap.domain.model.LiquidationEvent;
import com.liquidation.heatmap.domain.model.LiquidationLevel;
import com.liquidation.heatmap.domain.model.MarketSentiment;
import com.liquidation.heatmap.domain.model.OpenInterestSnapshot;
import com.liquidation.heatmap.domain.model.OrderBookImbalance;
import com.liquidation.heatmap.domain.model.PositionSide;
import com.liquidation.heatmap.domain.model.PriceSnapshot;
import com.liquidation.heatmap.domain.model.Signal;
import com.liquidation.heatmap.domain.model.SupportResistance;
import com.liquidation.heatmap.domain.model.SymbolSignalPayload;
import com.liquidation.heatmap.domain.service.refresh.CachedValue;
import com.liquidation.heatmap.domain.service.refresh.DataKind;
import com.liquidation.heatmap.domain.service.refresh.RefreshScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

@Slf4j
@Service
public class LiquidationHeatmapService {

    private static final int SUPPORT_RESISTANCE_LIMIT = 5;

    private final MarketDataSource marketDataSource;
    private final RefreshScheduler refreshScheduler;
    private final LevelDistributor levelDistributor;
    private final ClusterBuilder clusterBuilder;
    private final ClusterStore clusterStore;
    private final ConsumedZoneRegistry consumedZoneRegistry;
    private final LiquidationEventBuffer eventBuffer;
    private final SignalGenerator signalGenerator;
    private final MarketSentimentAnalyzer sentimentAnalyzer;
    private final ClusterProperties clusterProperties;
    private final SignalProperties signalProperties;
    private final ExecutorService batchSignalExecutor;
    private final Clock clock;

    public LiquidationHeatmapService(
            MarketDataSource marketDataSource,
            RefreshScheduler refreshScheduler,
            LevelDistributor levelDistributor,
            ClusterBuilder clusterBuilder,
            ClusterStore clusterStore,
            ConsumedZoneRegistry consumedZoneRegistry,
            LiquidationEventBuffer eventBuffer,
            SignalGenerator signalGenerator,
            MarketSentimentAnalyzer sentimentAnalyzer,
            ClusterProperties clusterProperties,
            SignalProperties signalProperties,
            @Qualifier("batchSignalExecutor") ExecutorService batchSignalExecutor,
            Clock clock) {
        this.marketDataSource = marketDataSource;
        this.refreshScheduler = refreshScheduler;
        this.levelDistributor = levelDistributor;
        this.clusterBuilder = clusterBuilder;
        this.clusterStore = clusterStore;
        this.consumedZoneRegistry = consumedZoneRegistry;
        this.eventBuffer = eventBuffer;
        this.signalGenerator = signalGenerator;
        this.sentimentAnalyzer = sentimentAnalyzer;
        this.clusterProperties = clusterProperties;
        this.signalProperties = signalProperties;
        this.batchSignalExecutor = batchSignalExecutor;
        this.clock = clock;
    }

    public String requireSupported(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new UnsupportedSymbolException(String.valueOf(symbol));
        }
        String normalized = symbol.trim().toUpperCase();
        if (!marketDataSource.supportedSymbols().contains(normalized)) {
            throw new UnsupportedSymbolException(normalized);
        }
        return normalized;
    }

    public CachedValue<PriceSnapshot> getPrice(String symbol) {
        return refreshScheduler.get(symbol, DataKind.PRICE, () -> marketDataSource.fetchPrice(symbol));
    }

    /**
     * Open interest valued at the cached price and split by the cached order book. Price, open
     * interest and depth are separate cache entries, each fetched with its own request.
     */
    public CachedValue<OpenInterestSnapshot> getOpenInterest(String symbol) {
        BigDecimal price = getPrice(symbol).value().price();
        OrderBookImbalance book = getOrderBook(symbol).orElse(null);
        return refreshScheduler.get(symbol, DataKind.OPEN_INTEREST,
                () -> marketDataSource.fetchOpenInterest(symbol, price).splitBy(book));
    }

    private Optional<OrderBookImbalance> getOrderBook(String symbol) {
        try {
            return Optional.of(refreshScheduler.get(symbol, DataKind.ORDER_BOOK,
                    () -> marketDataSource.fetchOrderBook(symbol)).value());
        } catch (DataUnavailableException e) {
            log.warn("[Heatmap] {} depth 없음 → OI 50/50 분할: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Latest cluster generation, rebuilt when its cache entry has expired.
     *
     * @throws DataUnavailableException when no generation can be produced or served
     */
    public CachedValue<ClusterGeneration> getClusters(String symbol, ClusterMode mode) {
        String normalized = requireSupported(symbol);
        requireEnabled(mode);
        return refreshScheduler.get(normalized, kindOf(mode), () -> rebuild(normalized, mode));
    }

    /** Forced rebuild, independent of cache expiry. */
    public CachedValue<ClusterGeneration> recompute(String symbol, ClusterMode mode) {
        String normalized = symbol.toUpperCase();
        requireEnabled(mode);
        return refreshScheduler.refresh(normalized, kindOf(mode), () -> rebuild(normalized, mode));
    }

    public Signal getSignal(String symbol, ClusterMode mode) {
        return getSignalPayload(symbol, mode).signal();
    }

    public SymbolSignalPayload getSignalPayload(String symbol, ClusterMode mode) {
        long now = clock.millis();
        try {
            CachedValue<ClusterGeneration> cached = getClusters(symbol, mode);
            ClusterGeneration generation = cached.value();
            Signal signal = signalGenerator.generate(
                    generation.symbol(), generation.referencePrice(), generation.clusters(), signalProperties.thresholds());

            return new SymbolSignalPayload(
                    generation.symbol(),
                    mode,
                    generation.referencePrice(),
                    signal,
                    generation.clusters(),
                    generation.generation(),
                    generation.stale() || cached.stale(),
                    cached.refreshFailed(),
                    now,
                    null);
        } catch (DataUnavailableException | MarketDataException | UnsupportedSymbolException e) {
            log.warn("[Heatmap] {} {} 시그널 생성 불가 → NEUTRAL: {}", symbol, mode, e.getMessage());
            return SymbolSignalPayload.failed(symbol == null ? null : symbol.toUpperCase(), mode, e.getMessage(), now);
        }
    }

    /**
     * Evaluates every symbol independently on the batch pool. The result keeps the request order
     * and one symbol's failure only affects its own entry.
     */
    public List<SymbolSignalPayload> getBatchSignals(List<String> symbols, ClusterMode mode) {
        List<CompletableFuture<SymbolSignalPayload>> futures = new ArrayList<>(symbols.size());
        for (String symbol : symbols) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> getSignalPayload(symbol, mode), batchSignalExecutor)
                    .exceptionally(e -> {
                        log.error("[Heatmap] {} 배치 시그널 처리 중 예외", symbol, e);
                        return SymbolSignalPayload.failed(symbol, mode, "Internal error: " + e.getMessage(), clock.millis());
                    }));
        }
        return futures.stream().map(CompletableFuture::join).toList();
    }

    public Optional<Cluster> getBestCluster(String symbol, ClusterMode mode, Double minStrength) {
        ClusterGeneration generation = getClusters(symbol, mode).value();
        double threshold = minStrength != null ? minStrength : 0.0;
        return generation.best(threshold);
    }

    public SupportResistance getSupportResistance(
            String symbol, ClusterMode mode, Double minStrength, Double maxDistancePct) {

        ClusterGeneration generation = getClusters(symbol, mode).value();
        SignalThresholds thresholds = signalProperties.thresholds().withFilters(minStrength, maxDistancePct);
        BigDecimal price = generation.referencePrice();

        List<Cluster> support = generation.clusters().stream()
                .filter(Cluster::isActive)
                .filter(c -> c.getSide() == PositionSide.LONG && c.isBelow(price))
                .filter(c -> passes(c, price, thresholds))
                .sorted(Comparator.comparing(Cluster::getPrice).reversed())
                .limit(SUPPORT_RESISTANCE_LIMIT)
                .toList();

        List<Cluster> resistance = generation.clusters().stream()
                .filter(Cluster::isActive)
                .filter(c -> c.getSide() == PositionSide.SHORT && c.isAbove(price))
                .filter(c -> passes(c, price, thresholds))
                .sorted(Comparator.comparing(Cluster::getPrice))
                .limit(SUPPORT_RESISTANCE_LIMIT)
                .toList();

        return new SupportResistance(generation.symbol(), mode, price, support, resistance, generation.timestamp());
    }

    public MarketSentiment getSentiment(String symbol) {
        String normalized = requireSupported(symbol);
        try {
            return sentimentAnalyzer.analyze(getOpenInterest(normalized).value());
        } catch (DataUnavailableException e) {
            log.warn("[Heatmap] {} OI 없음 → sentiment UNKNOWN: {}", normalized, e.getMessage());
            return MarketSentiment.unknown(normalized);
        }
    }

    public Map<String, Object> getStats() {
        long now = clock.millis();
        List<ClusterGeneration> generations = List.copyOf(clusterStore.getAll());

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("symbols", marketDataSource.supportedSymbols().stream().sorted().toList());
        stats.put("generations", generations.size());
        stats.put("totalClusters", generations.stream().mapToInt(g -> g.clusters().size()).sum());
        stats.put("activeClusters", generations.stream().mapToLong(ClusterGeneration::activeCount).sum());
        stats.put("staleGenerations", generations.stream().filter(ClusterGeneration::stale).count());

        Map<String, Long> ages = new LinkedHashMap<>();
        generations.stream()
                .sorted(Comparator.comparing(ClusterGeneration::symbol).thenComparing(ClusterGeneration::mode))
                .forEach(g -> ages.put(g.symbol() + "/" + g.mode(), clusterStore.getAgeMs(g.symbol(), g.mode(), now)));
        stats.put("generationAgeMs", ages);

        Map<String, Integer> buffered = new LinkedHashMap<>();
        eventBuffer.symbols().stream().sorted().forEach(s -> buffered.put(s, eventBuffer.size(s)));
        stats.put("bufferedEvents", buffered);
        stats.put("refreshEntries", refreshScheduler.entryCount());

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("defaultMode", clusterProperties.getDefaultMode());
        config.put("saturationK", clusterProperties.getSaturationK());
        config.put("leverageTiers", clusterProperties.getPredictive().getLeverageTiers());
        config.put("tierWeights", levelDistributor.getTierWeights());
        config.put("predictiveRules", clusterProperties.rulesFor(ClusterMode.PREDICTIVE));
        config.put("reactiveRules", clusterProperties.rulesFor(ClusterMode.REACTIVE));
        config.put("decayHalfLifeMs", clusterProperties.getReactive().getDecayHalfLifeMs());
        config.put("eventBufferCapacity", eventBuffer.getCapacity());
        config.put("signalThresholds", signalProperties.thresholds());
        stats.put("config", config);
        stats.put("timestamp", now);
        return stats;
    }

    public ClusterMode defaultMode() {
        return clusterProperties.getDefaultMode();
    }

    ClusterGeneration rebuild(String symbol, ClusterMode mode) {
        return mode == ClusterMode.PREDICTIVE ? rebuildPredictive(symbol) : rebuildReactive(symbol);
    }

    private ClusterGeneration rebuildPredictive(String symbol) {
        CachedValue<PriceSnapshot> price = getPrice(symbol);
        CachedValue<OpenInterestSnapshot> oi = getOpenInterest(symbol);
        long now = clock.millis();

        List<LiquidationLevel> levels = levelDistributor.distribute(price.value(), oi.value());
        List<Cluster> clusters = clusterBuilder.build(symbol, ClusterMode.PREDICTIVE, levels,
                price.value().price(), clusterProperties.rulesFor(ClusterMode.PREDICTIVE));

        return publish(symbol, ClusterMode.PREDICTIVE, price.value().price(), now,
                isDegraded(price) || isDegraded(oi), clusters);
    }

    private ClusterGeneration rebuildReactive(String symbol) {
        CachedValue<PriceSnapshot> price = getPrice(symbol);
        BigDecimal referencePrice = price.value().price();
        long now = clock.millis();

        Optional<ClusterGeneration> previous = clusterStore.getLatest(symbol, ClusterMode.REACTIVE);
        consumedZoneRegistry.recordCrossings(previous.orElse(null), referencePrice, now);
        consumedZoneRegistry.prune(symbol, now, clusterProperties.consumedZoneRetentionMs());

        List<LiquidationEvent> events = eventBuffer.snapshot(symbol);
        BucketingRules rules = clusterProperties.rulesFor(ClusterMode.REACTIVE);
        List<Cluster> clusters = clusterBuilder.build(symbol, ClusterMode.REACTIVE,
                levelDistributor.fromEvents(events, now), referencePrice, rules);
        clusters = consumedZoneRegistry.applyTo(symbol, clusters, rules.bucketWidthPct());

        return publish(symbol, ClusterMode.REACTIVE, referencePrice, now, isDegraded(price), clusters);
    }

    private ClusterGeneration publish(
            String symbol, ClusterMode mode, BigDecimal referencePrice, long now, boolean stale, List<Cluster> clusters) {

        ClusterGeneration generation = new ClusterGeneration(
                symbol, mode, clusterStore.nextGeneration(symbol, mode), referencePrice, now, stale, clusters);
        clusterStore.publish(generation);

        log.info("[Heatmap] {} {} gen={} 클러스터 {}개 (active={}) ref={} stale={}",
                symbol, mode, generation.generation(), clusters.size(), generation.activeCount(),
                referencePrice.toPlainString(), stale);
        return generation;
    }

    private boolean passes(Cluster cluster, BigDecimal price, SignalThresholds thresholds) {
        return cluster.getStrength() >= thresholds.minStrength()
                && ClusterBuilder.distancePercent(cluster.getPrice(), price) <= thresholds.maxDistancePct();
    }

    private void requireEnabled(ClusterMode mode) {
        if (!clusterProperties.isEnabled(mode)) {
            throw new DataUnavailableException(mode + " clustering is disabled");
        }
    }

    private static boolean isDegraded(CachedValue<?> value) {
        return value.stale() || value.refreshFailed();
    }

    private static DataKind kindOf(ClusterMode mode) {
        return mode == ClusterMode.PREDICTIVE ? DataKind.PREDICTIVE_CLUSTERS : DataKind.REACTIVE_CLUSTERS;
    }
}
