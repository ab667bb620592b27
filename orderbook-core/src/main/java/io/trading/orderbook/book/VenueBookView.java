package io.trading.orderbook.book;

import io.trading.orderbook.model.BestBidAsk;
import io.trading.orderbook.model.BookDepth;
import io.trading.orderbook.model.PriceLevel;
import io.trading.orderbook.price.PriceGrid;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Read-only view of a single venue's order book.
 */
public interface VenueBookView {

    /**
     * Grid precision fixed at construction.
     */
    int precision();

    PriceGrid grid();

    /**
     * Returns the top {@code n} levels per side, bids descending and asks ascending.
     *
     * @param n maximum number of levels per side; larger than the depth returns everything
     */
    BookDepth<PriceLevel> getDepthWithPrices(int n);

    Optional<PriceLevel> bestBid();

    Optional<PriceLevel> bestAsk();

    /**
     * Best bid and ask prices, empty unless both sides have liquidity.
     */
    Optional<BestBidAsk> bestBidAskPrices();

    /**
     * Resting size at a price, zero if the level is empty.
     */
    BigDecimal sizeAt(double price, boolean isBid);

    int bidLevels();

    int askLevels();

    boolean isEmpty();
}
