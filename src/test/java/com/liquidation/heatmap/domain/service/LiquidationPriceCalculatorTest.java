package com.liquidation.heatmap.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class LiquidationPriceCalculatorTest {

    private final LiquidationPriceCalculator calculator = new LiquidationPriceCalculator();

    @Test
    @DisplayName("10x long liquidates 10% below entry, short 10% above")
    void tenXLeverage() {
        BigDecimal price = new BigDecimal("100");

        assertEquals(0, new BigDecimal("90").compareTo(calculator.calculateLongLiquidationPrice(price, 10)));
        assertEquals(0, new BigDecimal("110").compareTo(calculator.calculateShortLiquidationPrice(price, 10)));
    }

    @Test
    @DisplayName("100x long liquidates 1% below entry")
    void hundredXLeverage() {
        BigDecimal result = calculator.calculateLongLiquidationPrice(new BigDecimal("50000"), 100);
        assertEquals(0, new BigDecimal("49500").compareTo(result));
    }

    @Test
    @DisplayName("long price is always below and short price above entry")
    void sidesStraddleEntry() {
        BigDecimal price = new BigDecimal("2500.5");
        for (int leverage : new int[]{2, 5, 25, 125}) {
            assertTrue(calculator.calculateLongLiquidationPrice(price, leverage).compareTo(price) < 0);
            assertTrue(calculator.calculateShortLiquidationPrice(price, leverage).compareTo(price) > 0);
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 0, -5})
    @DisplayName("leverage of 1 or less is rejected")
    void rejectsNonLeveraged(int leverage) {
        assertThrows(IllegalArgumentException.class,
                () -> calculator.calculateLongLiquidationPrice(new BigDecimal("100"), leverage));
    }

    @Test
    @DisplayName("non-positive price is rejected")
    void rejectsBadPrice() {
        assertThrows(IllegalArgumentException.class,
                () -> calculator.calculateShortLiquidationPrice(BigDecimal.ZERO, 10));
        assertThrows(IllegalArgumentException.class,
                () -> calculator.calculateShortLiquidationPrice(null, 10));
    }
}
