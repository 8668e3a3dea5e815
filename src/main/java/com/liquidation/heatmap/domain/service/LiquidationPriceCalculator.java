package com.liquidation.heatmap.domain.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

@Slf4j
@Service
public class LiquidationPriceCalculator {

    static final MathContext MC = new MathContext(12, RoundingMode.HALF_UP);

    public BigDecimal calculateLongLiquidationPrice(BigDecimal price, int leverage) {
        BigDecimal imr = initialMarginRate(price, leverage);
        return price.multiply(BigDecimal.ONE.subtract(imr, MC), MC);
    }

    public BigDecimal calculateShortLiquidationPrice(BigDecimal price, int leverage) {
        BigDecimal imr = initialMarginRate(price, leverage);
        return price.multiply(BigDecimal.ONE.add(imr, MC), MC);
    }

    private BigDecimal initialMarginRate(BigDecimal price, int leverage) {
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("price must be positive: " + price);
        }
        if (leverage <= 1) {
            throw new IllegalArgumentException("leverage must be greater than 1: " + leverage);
        }
        return BigDecimal.ONE.divide(BigDecimal.valueOf(leverage), MC);
    }
}
