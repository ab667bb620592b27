package io.trading.orderbook.book;

import io.trading.orderbook.error.InvalidPriceException;
import io.trading.orderbook.model.AggregatedLevel;
import io.trading.orderbook.model.BestBidAsk;
import io.trading.orderbook.model.BookDepth;
import io.trading.orderbook.model.CrossedBook;
import io.trading.orderbook.model.PriceLevel;
import io.trading.orderbook.model.QuoteCurrency;
import io.trading.orderbook.model.QuoteLevel;
import io.trading.orderbook.model.Venue;
import io.trading.orderbook.price.PriceGrid;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.longs.LongComparators;
import it.unimi.dsi.fastutil.objects.ObjectIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Liquidity of all venues merged onto one price grid.
 *
 * Each level keeps the size contributed by every venue quoting it plus a running
 * total, so one venue can be set, replaced or wiped without touching the others and
 * without re-summing. Sizes are {@link BigDecimal}, which keeps {@code total} exactly
 * equal to the sum of contributions. A level without contributions is removed.
 *
 * Prices are normalized per quote currency before quantization: a venue price is
 * multiplied by the book's rate for that venue's quote currency (1.0 by default).
 * Venues with a coarser tick than the grid may collapse onto a shared level when
 * their prices round to the same grid point.
 *
 * A single read/write lock guards both sides. Readers never see a partially applied
 * update, snapshot re-seed or rebuild.
 */
public class AggregatedBook implements AggregatedBookView {

    private static final Logger LOGGER = LoggerFactory.getLogger(AggregatedBook.class);

    /**
     * Depth limit meaning "every level of the venue book".
     */
    public static final int FULL_DEPTH = Integer.MAX_VALUE;

    private static final double RATE_TOLERANCE = 1e-12;

    private final PriceGrid grid;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Long2ObjectRBTreeMap<Level> bids = new Long2ObjectRBTreeMap<>(LongComparators.OPPOSITE_COMPARATOR);
    private final Long2ObjectRBTreeMap<Level> asks = new Long2ObjectRBTreeMap<>();

    // Indexed by QuoteCurrency ordinal, replaced as a whole under the write lock
    private volatile double[] quoteRates;

    public AggregatedBook(int precision) {
        this.grid = new PriceGrid(precision);
        double[] rates = new double[QuoteCurrency.values().length];
        Arrays.fill(rates, 1.0);
        this.quoteRates = rates;
    }

    @Override
    public int precision() {
        return grid.precision();
    }

    public PriceGrid grid() {
        return grid;
    }

    /**
     * Normalizes a venue-native price and quantizes it onto the aggregate grid.
     *
     * @throws InvalidPriceException if the price cannot be placed on the grid
     */
    public long toTicks(double price, Venue venue) {
        return grid.toTicks(normalize(price, venue));
    }

    /**
     * Sets {@code venue}'s absolute size at a venue-native price. A size &lt;= 0
     * removes the venue's contribution, and the level if nothing else remains.
     *
     * @throws InvalidPriceException if the price cannot be quantized
     */
    public void update(double price, BigDecimal size, boolean isBid, Venue venue) {
        updateLevel(toTicks(price, venue), size, isBid, venue);
    }

    public void update(double price, double size, boolean isBid, Venue venue) {
        update(price, QuoteLevel.sizeOf(size), isBid, venue);
    }

    /**
     * Same as {@link #update} for a tick key from {@link #toTicks}.
     */
    public void updateLevel(long ticks, BigDecimal size, boolean isBid, Venue venue) {
        if (size == null) {
            throw new IllegalArgumentException("size cannot be null");
        }
        if (venue == null) {
            throw new IllegalArgumentException("venue cannot be null");
        }
        lock.writeLock().lock();
        try {
            apply(isBid ? bids : asks, ticks, size, venue);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes every contribution of {@code venue} from both sides.
     */
    public void clearVenue(Venue venue) {
        lock.writeLock().lock();
        try {
            clearVenueLocked(venue);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces {@code venue}'s contribution with the top {@code depthLimit} levels of its book.
     * The old contribution is cleared first so levels the venue no longer quotes cannot linger.
     */
    public void updateFromVenue(Venue venue, VenueBookView book, int depthLimit) {
        BookDepth<PriceLevel> depth = book.getDepthWithPrices(depthLimit);
        long[] bidTicks = quantize(depth.bids(), venue);
        long[] askTicks = quantize(depth.asks(), venue);

        lock.writeLock().lock();
        try {
            clearVenueLocked(venue);
            seed(bids, bidTicks, depth.bids(), venue);
            seed(asks, askTicks, depth.asks(), venue);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drops everything and seeds the book from the given venue depths in one write.
     */
    public void rebuild(Map<Venue, BookDepth<PriceLevel>> depths) {
        Map<Venue, long[][]> ticks = new EnumMap<>(Venue.class);
        for (Map.Entry<Venue, BookDepth<PriceLevel>> entry : depths.entrySet()) {
            Venue venue = entry.getKey();
            BookDepth<PriceLevel> depth = entry.getValue();
            ticks.put(venue, new long[][] {quantize(depth.bids(), venue), quantize(depth.asks(), venue)});
        }

        lock.writeLock().lock();
        try {
            bids.clear();
            asks.clear();
            for (Map.Entry<Venue, BookDepth<PriceLevel>> entry : depths.entrySet()) {
                long[][] venueTicks = ticks.get(entry.getKey());
                seed(bids, venueTicks[0], entry.getValue().bids(), entry.getKey());
                seed(asks, venueTicks[1], entry.getValue().asks(), entry.getKey());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Sets the normalization rate for prices quoted in {@code currency}.
     *
     * Every stored key was computed with the old rate, so a real change clears the
     * book and the caller must re-seed it from the venue books.
     *
     * @return true if the rate changed and the book was cleared
     */
    public boolean updateQuoteRate(QuoteCurrency currency, double rate) {
        if (currency == null) {
            throw new IllegalArgumentException("currency cannot be null");
        }
        if (!Double.isFinite(rate) || rate <= 0.0) {
            throw new IllegalArgumentException("rate must be finite and positive: " + rate);
        }
        lock.writeLock().lock();
        try {
            double current = quoteRates[currency.ordinal()];
            if (Math.abs(current - rate) <= RATE_TOLERANCE * Math.max(current, rate)) {
                return false;
            }
            double[] rates = quoteRates.clone();
            rates[currency.ordinal()] = rate;
            quoteRates = rates;
            bids.clear();
            asks.clear();
            LOGGER.debug("Quote rate for {} changed {} -> {}, aggregated book cleared", currency, current, rate);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes every level of every venue.
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
    public double quoteRate(QuoteCurrency currency) {
        return quoteRates[currency.ordinal()];
    }

    @Override
    public BookDepth<AggregatedLevel> getDepthWithPrices(int n) {
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
    public Optional<AggregatedLevel> bestBid() {
        lock.readLock().lock();
        try {
            return first(bids);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<AggregatedLevel> bestAsk() {
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
            return Optional.of(new BestBidAsk(grid.toPrice(bids.firstLongKey()), grid.toPrice(asks.firstLongKey())));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<BestBidAsk> bestBidAskPricesByVenue(Venue venue) {
        lock.readLock().lock();
        try {
            if (bids.isEmpty() || asks.isEmpty()) {
                return Optional.empty();
            }
            // keys and factor must come from the same write generation
            double rate = quoteRates[venue.getQuoteCurrency().ordinal()];
            return Optional.of(new BestBidAsk(
                grid.toPrice(bids.firstLongKey()) / rate,
                grid.toPrice(asks.firstLongKey()) / rate
            ));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public BigDecimal volumeFromVenue(double price, boolean isBid, Venue venue) {
        long ticks = toTicks(price, venue);
        lock.readLock().lock();
        try {
            Level level = (isBid ? bids : asks).get(ticks);
            if (level == null) {
                return BigDecimal.ZERO;
            }
            return level.sources.getOrDefault(venue, BigDecimal.ZERO);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<AggregatedLevel> levelAt(long ticks, boolean isBid) {
        lock.readLock().lock();
        try {
            Level level = (isBid ? bids : asks).get(ticks);
            return level == null ? Optional.empty() : Optional.of(toLevel(ticks, level));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int levelCount(boolean isBid) {
        lock.readLock().lock();
        try {
            return (isBid ? bids : asks).size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Set<Venue> contributingVenues() {
        lock.readLock().lock();
        try {
            Set<Venue> venues = EnumSet.noneOf(Venue.class);
            for (Level level : bids.values()) {
                venues.addAll(level.sources.keySet());
            }
            for (Level level : asks.values()) {
                venues.addAll(level.sources.keySet());
            }
            return venues;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<CrossedBook> crossedBook() {
        lock.readLock().lock();
        try {
            if (bids.isEmpty() || asks.isEmpty()) {
                return Optional.empty();
            }
            long bestBid = bids.firstLongKey();
            long bestAsk = asks.firstLongKey();
            if (bestBid < bestAsk) {
                return Optional.empty();
            }
            return Optional.of(new CrossedBook(
                grid.toPrice(bestBid),
                grid.toPrice(bestAsk),
                bids.get(bestBid).sources.keySet(),
                asks.get(bestAsk).sources.keySet()
            ));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean isConsistent() {
        lock.readLock().lock();
        try {
            return sideConsistent(bids) && sideConsistent(asks);
        } finally {
            lock.readLock().unlock();
        }
    }

    private double normalize(double price, Venue venue) {
        if (venue == null) {
            throw new IllegalArgumentException("venue cannot be null");
        }
        return price * quoteRates[venue.getQuoteCurrency().ordinal()];
    }

    private long[] quantize(List<PriceLevel> levels, Venue venue) {
        long[] ticks = new long[levels.size()];
        for (int i = 0; i < ticks.length; i++) {
            ticks[i] = toTicks(levels.get(i).price(), venue);
        }
        return ticks;
    }

    private static void seed(Long2ObjectRBTreeMap<Level> side, long[] ticks, List<PriceLevel> levels, Venue venue) {
        for (int i = 0; i < ticks.length; i++) {
            apply(side, ticks[i], levels.get(i).size(), venue);
        }
    }

    private static void apply(Long2ObjectRBTreeMap<Level> side, long ticks, BigDecimal size, Venue venue) {
        Level level = side.get(ticks);
        if (size.signum() <= 0) {
            if (level != null) {
                level.remove(venue);
                if (level.isEmpty()) {
                    side.remove(ticks);
                }
            }
            return;
        }
        if (level == null) {
            level = new Level();
            side.put(ticks, level);
        }
        level.set(venue, size);
    }

    private void clearVenueLocked(Venue venue) {
        clearSide(bids, venue);
        clearSide(asks, venue);
    }

    private static void clearSide(Long2ObjectRBTreeMap<Level> side, Venue venue) {
        ObjectIterator<Long2ObjectMap.Entry<Level>> it = side.long2ObjectEntrySet().iterator();
        while (it.hasNext()) {
            Level level = it.next().getValue();
            level.remove(venue);
            if (level.isEmpty()) {
                it.remove();
            }
        }
    }

    private List<AggregatedLevel> top(Long2ObjectRBTreeMap<Level> side, int n) {
        List<AggregatedLevel> levels = new ArrayList<>(Math.min(n, side.size()));
        for (Long2ObjectMap.Entry<Level> entry : side.long2ObjectEntrySet()) {
            if (levels.size() >= n) {
                break;
            }
            levels.add(toLevel(entry.getLongKey(), entry.getValue()));
        }
        return levels;
    }

    private Optional<AggregatedLevel> first(Long2ObjectRBTreeMap<Level> side) {
        if (side.isEmpty()) {
            return Optional.empty();
        }
        long ticks = side.firstLongKey();
        return Optional.of(toLevel(ticks, side.get(ticks)));
    }

    private AggregatedLevel toLevel(long ticks, Level level) {
        return new AggregatedLevel(ticks, grid.toPrice(ticks), level.total, level.sources);
    }

    private static boolean sideConsistent(Long2ObjectRBTreeMap<Level> side) {
        for (Level level : side.values()) {
            if (level.isEmpty()) {
                return false;
            }
            BigDecimal sum = BigDecimal.ZERO;
            for (BigDecimal size : level.sources.values()) {
                if (size.signum() <= 0) {
                    return false;
                }
                sum = sum.add(size);
            }
            if (sum.compareTo(level.total) != 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Mutable per-level accumulator, only touched under the write lock.
     */
    private static final class Level {
        private final EnumMap<Venue, BigDecimal> sources = new EnumMap<>(Venue.class);
        private BigDecimal total = BigDecimal.ZERO;

        void set(Venue venue, BigDecimal size) {
            BigDecimal previous = sources.put(venue, size);
            total = total.add(size);
            if (previous != null) {
                total = total.subtract(previous);
            }
        }

        void remove(Venue venue) {
            BigDecimal previous = sources.remove(venue);
            if (previous != null) {
                total = total.subtract(previous);
            }
        }

        boolean isEmpty() {
            return sources.isEmpty();
        }
    }
}
