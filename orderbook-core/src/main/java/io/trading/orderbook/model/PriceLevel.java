package io.trading.orderbook.model;

import java.math.BigDecimal;

/**
 * Price level held by a single venue book.
 *
 * @param ticks Quantized price key
 * @param price Price reconstructed from the ticks
 * @param size  Resting size, always positive
 */
public record PriceLevel(
    long ticks,
    double price,
    BigDecimal size
) implements BookLevel {
    public PriceLevel {
        if (size == null) {
            throw new IllegalArgumentException("size cannot be null");
        }
        if (size.signum() <= 0) {
            throw new IllegalArgumentException("size must be positive");
        }
    }
}
