package com.liquidation.heatmap.domain.exception;

public class UnsupportedSymbolException extends RuntimeException {

    public UnsupportedSymbolException(String symbol) {
        super("Unsupported symbol: " + symbol);
    }
}
