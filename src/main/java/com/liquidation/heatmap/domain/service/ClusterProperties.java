package com.liquidation.heatmap.domain.service;

import com.liquidation.heatmap.domain.exception.InvalidConfigurationException;
import com.liquidation.heatmap.domain.model.ClusterMode;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "heatmap.cluster")
public class ClusterProperties {

    private ClusterMode defaultMode = ClusterMode.PREDICTIVE;

    /** Strength saturation constant k in min(1, sqrt(share * k)). */
    private double saturationK = 3.0;

    private Predictive predictive = new Predictive();
    private Reactive reactive = new Reactive();

    @Getter
    @Setter
    public static class Predictive {
        private boolean enabled = true;
        private List<Integer> leverageTiers = List.of(100, 50, 25, 10, 5);
        private double tierWeightExponent = 0.5;
        private double bucketWidthPct = 0.5;
        private int minMembers = 1;
        private double minWeightPct = 2.0;
        private long recomputeIntervalMs = 5_000;
    }

    @Getter
    @Setter
    public static class Reactive {
        private boolean enabled = true;
        private double bucketWidthPct = 0.5;
        private int minMembers = 2;
        private double minWeightPct = 0.0;
        private long decayHalfLifeMs = 3_600_000;
        private int bufferCapacity = 2_048;
        private long rebuildIntervalMs = 5_000;
        private int consumedZoneRetentionHalfLives = 10;
    }

    public BucketingRules rulesFor(ClusterMode mode) {
        return switch (mode) {
            case PREDICTIVE -> new BucketingRules(
                    predictive.bucketWidthPct, predictive.minMembers, predictive.minWeightPct, saturationK);
            case REACTIVE -> new BucketingRules(
                    reactive.bucketWidthPct, reactive.minMembers, reactive.minWeightPct, saturationK);
        };
    }

    public boolean isEnabled(ClusterMode mode) {
        return mode == ClusterMode.PREDICTIVE ? predictive.enabled : reactive.enabled;
    }

    public long consumedZoneRetentionMs() {
        return reactive.decayHalfLifeMs * reactive.consumedZoneRetentionHalfLives;
    }

    @PostConstruct
    public void validate() {
        List<Integer> tiers = predictive.leverageTiers;
        if (tiers == null || tiers.isEmpty()) {
            throw new InvalidConfigurationException("heatmap.cluster.predictive.leverage-tiers must not be empty");
        }
        for (Integer tier : tiers) {
            if (tier == null || tier <= 1) {
                throw new InvalidConfigurationException(
                        "leverage tier must be greater than 1: " + tier);
            }
        }
        if (saturationK <= 0) {
            throw new InvalidConfigurationException("heatmap.cluster.saturation-k must be positive: " + saturationK);
        }
        if (predictive.tierWeightExponent < 0) {
            throw new InvalidConfigurationException("tier-weight-exponent must not be negative");
        }
        requireBucketRules("predictive", predictive.bucketWidthPct, predictive.minMembers, predictive.minWeightPct);
        requireBucketRules("reactive", reactive.bucketWidthPct, reactive.minMembers, reactive.minWeightPct);
        if (reactive.decayHalfLifeMs <= 0) {
            throw new InvalidConfigurationException("heatmap.cluster.reactive.decay-half-life-ms must be positive");
        }
        if (reactive.bufferCapacity <= 0) {
            throw new InvalidConfigurationException("heatmap.cluster.reactive.buffer-capacity must be positive");
        }
        if (predictive.recomputeIntervalMs <= 0 || reactive.rebuildIntervalMs <= 0) {
            throw new InvalidConfigurationException("recompute intervals must be positive");
        }
        if (reactive.consumedZoneRetentionHalfLives <= 0) {
            throw new InvalidConfigurationException("consumed-zone-retention-half-lives must be positive");
        }
    }

    private static void requireBucketRules(String mode, double widthPct, int minMembers, double minWeightPct) {
        if (widthPct <= 0) {
            throw new InvalidConfigurationException(mode + " bucket-width-pct must be positive: " + widthPct);
        }
        if (minMembers < 1) {
            throw new InvalidConfigurationException(mode + " min-members must be at least 1: " + minMembers);
        }
        if (minWeightPct < 0 || minWeightPct > 100) {
            throw new InvalidConfigurationException(mode + " min-weight-pct must be within [0, 100]: " + minWeightPct);
        }
    }
}
