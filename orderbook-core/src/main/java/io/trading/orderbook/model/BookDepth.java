package io.trading.orderbook.model;

import java.util.List;

/**
 * Top of book for both sides.
 *
 * @param bids Bid levels, strictly descending by price
 * @param asks Ask levels, strictly ascending by price
 * @param <L>  Level type
 */
public record BookDepth<L extends BookLevel>(
    List<L> bids,
    List<L> asks
) {
    public BookDepth {
        if (bids == null) {
            throw new IllegalArgumentException("bids cannot be null");
        }
        if (asks == null) {
            throw new IllegalArgumentException("asks cannot be null");
        }
        bids = List.copyOf(bids);
        asks = List.copyOf(asks);
    }

    public static <L extends BookLevel> BookDepth<L> empty() {
        return new BookDepth<>(List.of(), List.of());
    }

    public boolean isEmpty() {
        return bids.isEmpty() && asks.isEmpty();
    }
}
