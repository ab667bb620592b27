package io.trading.aggregator.feed;

import io.trading.orderbook.model.QuoteLevel;
import io.trading.orderbook.model.Venue;

import java.math.BigDecimal;
import java.util.List;

/**
 * A unit of work queued on the {@link BookUpdateSequencer}.
 *
 * @param type          Event type
 * @param venue         Source venue
 * @param price         Level price (LEVEL_UPDATE only)
 * @param size          Absolute level size (LEVEL_UPDATE only)
 * @param isBid         Side (LEVEL_UPDATE only)
 * @param bids          Bid levels (SNAPSHOT only)
 * @param asks          Ask levels (SNAPSHOT only)
 * @param receivedNanos Receive timestamp from {@link System#nanoTime()}
 */
public record BookEvent(
    Type type,
    Venue venue,
    double price,
    BigDecimal size,
    boolean isBid,
    List<QuoteLevel> bids,
    List<QuoteLevel> asks,
    long receivedNanos
) {
    public enum Type {
        SNAPSHOT,
        LEVEL_UPDATE,
        RESET
    }

    public BookEvent {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (venue == null) {
            throw new IllegalArgumentException("venue cannot be null");
        }
        if (type == Type.LEVEL_UPDATE && size == null) {
            throw new IllegalArgumentException("size cannot be null");
        }
        if (type == Type.SNAPSHOT && (bids == null || asks == null)) {
            throw new IllegalArgumentException("bids and asks cannot be null");
        }
    }

    public static BookEvent snapshot(Venue venue, List<QuoteLevel> bids, List<QuoteLevel> asks) {
        return new BookEvent(Type.SNAPSHOT, venue, Double.NaN, null, false,
            List.copyOf(bids), List.copyOf(asks), System.nanoTime());
    }

    public static BookEvent levelUpdate(Venue venue, double price, BigDecimal size, boolean isBid) {
        return new BookEvent(Type.LEVEL_UPDATE, venue, price, size, isBid, null, null, System.nanoTime());
    }

    public static BookEvent reset(Venue venue) {
        return new BookEvent(Type.RESET, venue, Double.NaN, null, false, null, null, System.nanoTime());
    }
}
