package io.trading.aggregator.feed;

import io.trading.orderbook.model.Venue;

/**
 * Interface for venue market data adapters.
 * Implementations handle the venue connection, subscription and message parsing,
 * and push parsed book data into a {@link BookUpdateHandler}.
 */
public interface VenueFeed extends AutoCloseable {

    /**
     * Gets the venue identifier.
     */
    Venue getVenue();

    /**
     * Connects to the venue. A connected feed starts with a full snapshot.
     */
    void connect();

    /**
     * Disconnects from the venue.
     */
    void disconnect();

    /**
     * Returns whether the feed is currently connected.
     */
    boolean isConnected();

    /**
     * Sets the handler for parsed book data.
     *
     * @param handler The handler to call when book data is received
     */
    void setUpdateHandler(BookUpdateHandler handler);

    @Override
    default void close() {
        disconnect();
    }
}
