package io.trading.orderbook.model;

import java.util.Set;

/**
 * Observation that the aggregated best bid is not below the best ask.
 * Surfaced to callers, never resolved by the book itself.
 *
 * @param bestBid   Best bid price on the aggregate axis
 * @param bestAsk   Best ask price on the aggregate axis
 * @param bidVenues Venues quoting the best bid
 * @param askVenues Venues quoting the best ask
 */
public record CrossedBook(
    double bestBid,
    double bestAsk,
    Set<Venue> bidVenues,
    Set<Venue> askVenues
) {
    public CrossedBook {
        bidVenues = Set.copyOf(bidVenues);
        askVenues = Set.copyOf(askVenues);
    }
}
