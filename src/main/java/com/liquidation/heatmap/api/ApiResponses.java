package com.liquidation.heatmap.api;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

final class ApiResponses {

    private ApiResponses() {
    }

    static ResponseEntity<Object> badRequest(String symbol, String message) {
        return ResponseEntity.badRequest().body(failure(symbol, message));
    }

    static ResponseEntity<Object> unavailable(String symbol, String message) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(failure(symbol, message));
    }

    private static Map<String, Object> failure(String symbol, String message) {
        return Map.of(
                "success", false,
                "symbol", symbol == null ? "" : symbol.toUpperCase(),
                "message", message == null ? "unknown error" : message);
    }
}
