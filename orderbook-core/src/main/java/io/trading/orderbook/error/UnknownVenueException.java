package io.trading.orderbook.error;

import io.trading.orderbook.model.Venue;

/**
 * Thrown when data arrives for a venue that is not registered.
 * The data is dropped; accepting it would corrupt aggregate attribution.
 */
public class UnknownVenueException extends OrderBookException {

    private final Venue venue;

    public UnknownVenueException(Venue venue) {
        super("Venue not registered: " + (venue == null ? "null" : venue.name()));
        this.venue = venue;
    }

    public Venue getVenue() {
        return venue;
    }
}
