package io.trading.aggregator.feed;

import io.trading.orderbook.model.QuoteLevel;
import io.trading.orderbook.model.Venue;

import java.math.BigDecimal;
import java.util.List;

/**
 * Handler interface for parsed venue book data.
 */
public interface BookUpdateHandler {

    /**
     * Called when a full book snapshot is received.
     */
    void onSnapshot(Venue venue, List<QuoteLevel> bids, List<QuoteLevel> asks);

    /**
     * Called when a single level changes. The size is absolute; zero deletes the level.
     */
    void onLevelUpdate(Venue venue, double price, BigDecimal size, boolean isBid);

    /**
     * Called when the feed loses its connection. The venue book is no longer trustworthy.
     */
    void onDisconnect(Venue venue);
}
