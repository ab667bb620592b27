package io.trading.orderbook.model;

import java.math.BigDecimal;

/**
 * Common read shape of venue and aggregated price levels.
 */
public interface BookLevel {

    /**
     * Quantized price key.
     */
    long ticks();

    /**
     * Price on the owning book's grid.
     */
    double price();

    /**
     * Total resting size at this level.
     */
    BigDecimal size();
}
