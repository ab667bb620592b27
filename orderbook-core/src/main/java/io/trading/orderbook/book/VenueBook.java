package io.trading.orderbook.book;

import io.trading.orderbook.error.InvalidPriceException;
import io.trading.orderbook.model.BestBidAsk;
import io.trading.orderbook.model.BookDepth;
import io.trading.orderbook.model.PriceLevel;
import io.trading.orderbook.model.QuoteLevel;
import io.trading.orderbook.price.PriceGrid;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.longs.LongComparators;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Order book of a single venue.
 *
 * Bids and asks are red-black tree maps from tick key to resting size:
 * - bids use the opposite comparator, so the first key is the best (highest) bid
 * - asks use natural order, so the first key is the best (lowest) ask
 *
 * The book is seeded by {@link #applySnapshot} and then maintained with absolute
 * {@link #update} diffs. Sequencing of diffs is the feed adapter's responsibility.
 *
 * Writers must be serialized per book (one feed thread per venue). Readers may run
 * concurrently with the writer and always observe whole updates.
 */
public class VenueBook implements VenueBookView {

    private final PriceGrid grid;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private Long2ObjectRBTreeMap<BigDecimal> bids = newBidMap();
    private Long2ObjectRBTreeMap<BigDecimal> asks = newAskMap();

    public VenueBook(int precision) {
        this.grid = new PriceGrid(precision);
    }

    @Override
    public int precision() {
        return grid.precision();
    }

    @Override
    public PriceGrid grid() {
        return grid;
    }

    /**
     * Replaces the whole book.
     *
     * All levels are quantized before anything is touched: one invalid price rejects
     * the snapshot and the previous state stays in place. Levels with size &lt;= 0 are
     * dropped, and for repeated prices the last level wins.
     *
     * @throws InvalidPriceException if any level has a price the grid rejects
     */
    public void applySnapshot(List<QuoteLevel> bidLevels, List<QuoteLevel> askLevels) {
        Long2ObjectRBTreeMap<BigDecimal> newBids = newBidMap();
        Long2ObjectRBTreeMap<BigDecimal> newAsks = newAskMap();
        fill(newBids, bidLevels);
        fill(newAsks, askLevels);

        lock.writeLock().lock();
        try {
            this.bids = newBids;
            this.asks = newAsks;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Sets the absolute resting size at a price. A size &lt;= 0 removes the level.
     *
     * @throws InvalidPriceException if the price cannot be quantized
     */
    public void update(double price, BigDecimal size, boolean isBid) {
        updateLevel(grid.toTicks(price), size, isBid);
    }

    public void update(double price, double size, boolean isBid) {
        update(price, QuoteLevel.sizeOf(size), isBid);
    }

    /**
     * Same as {@link #update} for a price already quantized on this book's grid.
     */
    public void updateLevel(long ticks, BigDecimal size, boolean isBid) {
        if (size == null) {
            throw new IllegalArgumentException("size cannot be null");
        }
        lock.writeLock().lock();
        try {
            Long2ObjectRBTreeMap<BigDecimal> side = isBid ? bids : asks;
            if (size.signum() <= 0) {
                side.remove(ticks);
            } else {
                side.put(ticks, size);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes every level.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            bids.clear();
            asks.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public BookDepth<PriceLevel> getDepthWithPrices(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("depth cannot be negative: " + n);
        }
        if (n == 0) {
            return BookDepth.empty();
        }
        lock.readLock().lock();
        try {
            return new BookDepth<>(top(bids, n), top(asks, n));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<PriceLevel> bestBid() {
        lock.readLock().lock();
        try {
            return first(bids);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<PriceLevel> bestAsk() {
        lock.readLock().lock();
        try {
            return first(asks);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<BestBidAsk> bestBidAskPrices() {
        lock.readLock().lock();
        try {
            if (bids.isEmpty() || asks.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new BestBidAsk(
                grid.toPrice(bids.firstLongKey()),
                grid.toPrice(asks.firstLongKey())
            ));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public BigDecimal sizeAt(double price, boolean isBid) {
        long ticks = grid.toTicks(price);
        lock.readLock().lock();
        try {
            BigDecimal size = (isBid ? bids : asks).get(ticks);
            return size == null ? BigDecimal.ZERO : size;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int bidLevels() {
        lock.readLock().lock();
        try {
            return bids.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int askLevels() {
        lock.readLock().lock();
        try {
            return asks.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean isEmpty() {
        lock.readLock().lock();
        try {
            return bids.isEmpty() && asks.isEmpty();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void fill(Long2ObjectRBTreeMap<BigDecimal> side, List<QuoteLevel> levels) {
        if (levels == null) {
            throw new IllegalArgumentException("snapshot levels cannot be null");
        }
        for (QuoteLevel level : levels) {
            long ticks = grid.toTicks(level.price());
            if (level.isDelete()) {
                side.remove(ticks);
            } else {
                side.put(ticks, level.size());
            }
        }
    }

    private List<PriceLevel> top(Long2ObjectRBTreeMap<BigDecimal> side, int n) {
        List<PriceLevel> levels = new ArrayList<>(Math.min(n, side.size()));
        for (Long2ObjectMap.Entry<BigDecimal> entry : side.long2ObjectEntrySet()) {
            if (levels.size() >= n) {
                break;
            }
            levels.add(toLevel(entry.getLongKey(), entry.getValue()));
        }
        return levels;
    }

    private Optional<PriceLevel> first(Long2ObjectRBTreeMap<BigDecimal> side) {
        if (side.isEmpty()) {
            return Optional.empty();
        }
        long ticks = side.firstLongKey();
        return Optional.of(toLevel(ticks, side.get(ticks)));
    }

    private PriceLevel toLevel(long ticks, BigDecimal size) {
        return new PriceLevel(ticks, grid.toPrice(ticks), size);
    }

    private static Long2ObjectRBTreeMap<BigDecimal> newBidMap() {
        return new Long2ObjectRBTreeMap<>(LongComparators.OPPOSITE_COMPARATOR);
    }

    private static Long2ObjectRBTreeMap<BigDecimal> newAskMap() {
        return new Long2ObjectRBTreeMap<>();
    }
}
