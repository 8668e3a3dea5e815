package com.liquidation.heatmap.domain.service;

public record BucketingRules(
        double bucketWidthPct,
        int minMembers,
        double minWeightPct,
        double saturationK
) {
}
