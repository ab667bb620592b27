package io.trading.orderbook.book;

import io.trading.orderbook.model.AggregatedLevel;
import io.trading.orderbook.model.BestBidAsk;
import io.trading.orderbook.model.BookDepth;
import io.trading.orderbook.model.CrossedBook;
import io.trading.orderbook.model.QuoteCurrency;
import io.trading.orderbook.model.Venue;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of the cross-venue aggregated book.
 */
public interface AggregatedBookView {

    int precision();

    /**
     * Returns the top {@code n} aggregated levels per side with venue attribution,
     * bids descending and asks ascending.
     */
    BookDepth<AggregatedLevel> getDepthWithPrices(int n);

    Optional<AggregatedLevel> bestBid();

    Optional<AggregatedLevel> bestAsk();

    /**
     * Best prices on the aggregate axis, empty unless both sides have liquidity.
     */
    Optional<BestBidAsk> bestBidAskPrices();

    /**
     * Best prices projected back into the quote currency of {@code venue}.
     */
    Optional<BestBidAsk> bestBidAskPricesByVenue(Venue venue);

    /**
     * Size {@code venue} contributes at a venue-native price, zero if none.
     */
    BigDecimal volumeFromVenue(double price, boolean isBid, Venue venue);

    /**
     * Level at an aggregate tick key, with the venues quoting it.
     */
    Optional<AggregatedLevel> levelAt(long ticks, boolean isBid);

    int levelCount(boolean isBid);

    /**
     * Venues with at least one level in the book.
     */
    Set<Venue> contributingVenues();

    /**
     * Present when the best bid is at or above the best ask.
     */
    Optional<CrossedBook> crossedBook();

    /**
     * Multiplier applied to prices quoted in {@code currency} before quantization.
     */
    double quoteRate(QuoteCurrency currency);

    /**
     * Verifies that every level's total equals the sum of its venue contributions
     * and that no empty level is stored.
     */
    boolean isConsistent();
}
