package com.liquidation.heatmap.domain.service.refresh;

public enum DataKind {

    PRICE(true),
    OPEN_INTEREST(true),
    ORDER_BOOK(true),
    PREDICTIVE_CLUSTERS(false),
    REACTIVE_CLUSTERS(false);

    private final boolean upstream;

    DataKind(boolean upstream) {
        this.upstream = upstream;
    }

    /** Upstream kinds hit the exchange and go through the rate limiter, timeout and retry. */
    public boolean isUpstream() {
        return upstream;
    }
}
