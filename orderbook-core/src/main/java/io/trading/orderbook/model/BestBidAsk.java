package io.trading.orderbook.model;

/**
 * Best bid and best ask prices of a book.
 *
 * @param bid Highest bid price
 * @param ask Lowest ask price
 */
public record BestBidAsk(
    double bid,
    double ask
) {

    /**
     * Ask minus bid. Negative or zero when the book is crossed.
     */
    public double spread() {
        return ask - bid;
    }

    public double mid() {
        return (bid + ask) / 2.0;
    }

    public boolean isCrossed() {
        return bid >= ask;
    }
}
