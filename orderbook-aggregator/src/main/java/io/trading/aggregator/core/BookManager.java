package io.trading.aggregator.core;

import io.prometheus.client.CollectorRegistry;
import io.trading.aggregator.config.AggregatorConfig;
import io.trading.aggregator.metrics.AggregatorMetrics;
import io.trading.orderbook.book.AggregatedBook;
import io.trading.orderbook.book.AggregatedBookView;
import io.trading.orderbook.book.VenueBook;
import io.trading.orderbook.book.VenueBookView;
import io.trading.orderbook.error.InvalidPriceException;
import io.trading.orderbook.error.UnknownVenueException;
import io.trading.orderbook.model.BestBidAsk;
import io.trading.orderbook.model.BookDepth;
import io.trading.orderbook.model.CrossedBook;
import io.trading.orderbook.model.PriceLevel;
import io.trading.orderbook.model.QuoteCurrency;
import io.trading.orderbook.model.QuoteLevel;
import io.trading.orderbook.model.Venue;
import io.trading.orderbook.price.PriceGrid;
import io.trading.orderbook.price.UsdConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Owns one {@link VenueBook} per registered venue and the shared {@link AggregatedBook}.
 *
 * Every mutation of a venue goes through that venue's writer lock, so the venue book and
 * its contribution to the aggregate change together. Locks are always taken venue first
 * (in enum order when several are needed), aggregate second.
 */
public class BookManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(BookManager.class);

    public static final Duration DEFAULT_RATE_TTL = Duration.ofSeconds(60);

    static final String REASON_INVALID_PRICE = "invalid_price";
    static final String REASON_UNKNOWN_VENUE = "unknown_venue";

    private final AggregatedBook aggregated;
    private final int aggregationDepth;
    private final QuoteCurrency aggregateCurrency;
    private final boolean normalizeQuotes;
    private final UsdConverter usdConverter;
    private final AggregatorMetrics metrics;

    private final Map<Venue, VenueSlot> slots = new ConcurrentHashMap<>();
    private final Object registryLock = new Object();
    private final AtomicBoolean crossed = new AtomicBoolean();

    private volatile Consumer<CrossedBook> crossedBookListener;

    public BookManager(int aggregatePrecision) {
        this(aggregatePrecision, AggregatedBook.FULL_DEPTH, QuoteCurrency.USDT, false,
            new UsdConverter(DEFAULT_RATE_TTL), new AggregatorMetrics(new CollectorRegistry()));
    }

    /**
     * @param aggregatePrecision Decimal digits of the aggregated price grid
     * @param aggregationDepth   Levels per venue folded in on snapshot and resync, 0 = all
     * @param aggregateCurrency  Currency of the aggregated price axis
     * @param normalizeQuotes    Convert venue quotes onto the aggregate currency axis
     * @param usdConverter       USD rate cache
     * @param metrics            Prometheus metrics
     */
    public BookManager(int aggregatePrecision, int aggregationDepth, QuoteCurrency aggregateCurrency,
                       boolean normalizeQuotes, UsdConverter usdConverter, AggregatorMetrics metrics) {
        if (aggregationDepth < 0) {
            throw new IllegalArgumentException("aggregationDepth cannot be negative");
        }
        if (aggregateCurrency == null) {
            throw new IllegalArgumentException("aggregateCurrency cannot be null");
        }
        if (usdConverter == null) {
            throw new IllegalArgumentException("usdConverter cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
        this.aggregated = new AggregatedBook(aggregatePrecision);
        this.aggregationDepth = aggregationDepth == 0 ? AggregatedBook.FULL_DEPTH : aggregationDepth;
        this.aggregateCurrency = aggregateCurrency;
        this.normalizeQuotes = normalizeQuotes;
        this.usdConverter = usdConverter;
        this.metrics = metrics;
    }

    /**
     * Creates a manager and registers every configured venue.
     */
    public static BookManager fromConfig(AggregatorConfig config, AggregatorMetrics metrics) {
        BookManager manager = new BookManager(
            config.aggregatePrecision(),
            config.aggregationDepth(),
            config.aggregateCurrency(),
            config.normalizeQuotes(),
            new UsdConverter(Duration.ofMillis(config.rateTtlMs())),
            metrics
        );
        config.venuePrecisions().forEach(manager::addVenue);
        return manager;
    }

    /**
     * Registers a venue with an empty book. Re-registering clears the venue's previous
     * contribution and replaces its book.
     */
    public void addVenue(Venue venue, int precision) {
        if (venue == null) {
            throw new IllegalArgumentException("venue cannot be null");
        }
        VenueBook book = new VenueBook(precision);

        synchronized (registryLock) {
            VenueSlot existing = slots.get(venue);
            if (existing == null) {
                VenueSlot slot = new VenueSlot(venue, book);
                slots.put(venue, slot);
                transition(slot, VenueState.REGISTERED);
                LOGGER.info("[{}] Registered venue (precision: {})", venue, precision);
                return;
            }

            existing.writeLock.lock();
            try {
                existing.book = book;
                aggregated.clearVenue(venue);
                existing.metrics.recordResync();
                metrics.recordResync(venue);
                transition(existing, VenueState.REGISTERED);
            } finally {
                existing.writeLock.unlock();
            }
            LOGGER.info("[{}] Re-registered venue (precision: {})", venue, precision);
        }
        afterAggregateMutation();
    }

    /**
     * Removes a venue and its contribution to the aggregated book.
     */
    public void removeVenue(Venue venue) {
        synchronized (registryLock) {
            VenueSlot slot = slots.get(venue);
            if (slot == null) {
                throw unknownVenue(venue);
            }
            slot.writeLock.lock();
            try {
                slot.removed = true;
                aggregated.clearVenue(venue);
                slots.remove(venue);
                transition(slot, VenueState.UNREGISTERED);
            } finally {
                slot.writeLock.unlock();
            }
        }
        LOGGER.info("[{}] Removed venue", venue);
        afterAggregateMutation();
    }

    /**
     * Replaces a venue's book with a full snapshot and re-seeds its contribution.
     * An invalid level rejects the whole snapshot and leaves both books untouched.
     */
    public void applySnapshot(Venue venue, List<QuoteLevel> bids, List<QuoteLevel> asks) {
        VenueSlot slot = acquire(venue);
        try {
            try {
                checkAggregateGrid(slot, bids);
                checkAggregateGrid(slot, asks);
                slot.book.applySnapshot(bids, asks);
            } catch (InvalidPriceException e) {
                metrics.recordRejected(venue, REASON_INVALID_PRICE);
                LOGGER.warn("[{}] Rejected snapshot: {}", venue, e.getMessage());
                throw e;
            }

            aggregated.updateFromVenue(venue, slot.book, aggregationDepth);

            if (slot.state == VenueState.LIVE) {
                slot.metrics.recordResync();
                metrics.recordResync(venue);
            }
            slot.metrics.recordSnapshot(System.currentTimeMillis());
            metrics.recordSnapshotApplied(venue);
            recordBestPrices(slot);
            transition(slot, VenueState.SNAPSHOTTED);
            LOGGER.debug("[{}] Applied snapshot: {} bids, {} asks",
                venue, slot.book.bidLevels(), slot.book.askLevels());
        } finally {
            slot.writeLock.unlock();
        }
        afterAggregateMutation();
    }

    /**
     * Applies an absolute size for one price level. A non-positive size deletes the level.
     */
    public void updateOrderbook(Venue venue, double price, BigDecimal size, boolean isBid) {
        if (size == null) {
            throw new IllegalArgumentException("size cannot be null");
        }
        VenueSlot slot = acquire(venue);
        try {
            long venueTicks;
            long aggregateTicks;
            try {
                venueTicks = slot.book.grid().toTicks(price);
                aggregateTicks = aggregated.toTicks(price, venue);
            } catch (InvalidPriceException e) {
                metrics.recordRejected(venue, REASON_INVALID_PRICE);
                LOGGER.warn("[{}] Rejected update at price {}: {}", venue, price, e.getMessage());
                throw e;
            }

            slot.book.updateLevel(venueTicks, size, isBid);
            aggregated.updateLevel(aggregateTicks, size, isBid, venue);

            slot.metrics.recordUpdate(System.currentTimeMillis());
            metrics.recordUpdateApplied(venue);
            recordBestPrices(slot);
            if (slot.state == VenueState.SNAPSHOTTED) {
                transition(slot, VenueState.LIVE);
            }
        } finally {
            slot.writeLock.unlock();
        }
        afterAggregateMutation();
    }

    public void updateOrderbook(Venue venue, double price, double size, boolean isBid) {
        BigDecimal decimalSize;
        try {
            decimalSize = QuoteLevel.sizeOf(size);
        } catch (InvalidPriceException e) {
            metrics.recordRejected(venue, REASON_INVALID_PRICE);
            LOGGER.warn("[{}] Rejected update at price {}: {}", venue, price, e.getMessage());
            throw e;
        }
        updateOrderbook(venue, price, decimalSize, isBid);
    }

    /**
     * Drops a venue's book and contribution after a disconnect or a stale feed.
     * The venue stays registered and waits for a new snapshot.
     */
    public void resetVenue(Venue venue) {
        VenueSlot slot = acquire(venue);
        try {
            resetLocked(slot);
        } finally {
            slot.writeLock.unlock();
        }
        LOGGER.info("[{}] Reset venue, waiting for snapshot", venue);
        afterAggregateMutation();
    }

    /**
     * Resets a synced venue whose last snapshot or update is at least {@code staleAfterMs} old.
     * Staleness is decided under the venue's writer lock, so an update that lands first keeps the venue.
     *
     * @return true if the venue was reset
     */
    public boolean resetIfStale(Venue venue, long nowMs, long staleAfterMs) {
        VenueSlot slot = acquire(venue);
        try {
            if (!slot.state.isSynced() || nowMs - slot.metrics.getLastUpdateTimeMs() < staleAfterMs) {
                return false;
            }
            resetLocked(slot);
        } finally {
            slot.writeLock.unlock();
        }
        LOGGER.info("[{}] Reset stale venue, waiting for snapshot", venue);
        afterAggregateMutation();
        return true;
    }

    /**
     * Rebuilds the aggregated book from every venue book in a single write.
     */
    public void updateAggregatedOrderbook() {
        List<VenueSlot> locked = lockAll();
        try {
            rebuildLocked(locked);
        } finally {
            unlockAll(locked);
        }
        LOGGER.debug("Rebuilt aggregated book from {} venues", locked.size());
        afterAggregateMutation();
    }

    /**
     * Refreshes a USD rate. With quote normalization enabled, a changed conversion factor
     * rebuilds the aggregated book on the new axis.
     *
     * @param currency The quote currency
     * @param usdRate  USD value of one unit of the currency
     */
    public void updateUsdRate(QuoteCurrency currency, double usdRate) {
        usdConverter.updateRate(currency, usdRate);
        if (!normalizeQuotes) {
            return;
        }

        OptionalDouble axisRate = usdConverter.rate(aggregateCurrency);
        if (axisRate.isEmpty()) {
            LOGGER.debug("No fresh {} rate yet, keeping current quote factors", aggregateCurrency);
            return;
        }

        boolean changed = false;
        List<VenueSlot> locked = lockAll();
        try {
            for (QuoteCurrency quote : QuoteCurrency.values()) {
                OptionalDouble quoteRate = usdConverter.rate(quote);
                if (quote == aggregateCurrency || quoteRate.isEmpty()) {
                    continue;
                }
                double factor = quoteRate.getAsDouble() / axisRate.getAsDouble();
                changed |= aggregated.updateQuoteRate(quote, factor);
            }
            if (changed) {
                rebuildLocked(locked);
            }
        } finally {
            unlockAll(locked);
        }

        if (changed) {
            LOGGER.info("Quote factors changed after {} rate update, aggregated book rebuilt", currency);
            afterAggregateMutation();
        }
    }

    /**
     * Best aggregated prices converted to USD.
     *
     * @throws io.trading.orderbook.error.RateStaleException if the aggregate currency rate is missing or stale
     */
    public Optional<BestBidAsk> aggregatedBestBidAskUsd() {
        Optional<BestBidAsk> best = aggregated.bestBidAskPrices();
        if (best.isEmpty()) {
            return best;
        }
        BestBidAsk prices = best.get();
        return Optional.of(new BestBidAsk(
            usdConverter.convert(aggregateCurrency, prices.bid()),
            usdConverter.convert(aggregateCurrency, prices.ask())
        ));
    }

    /**
     * Best prices of a single venue book converted to USD using the venue's quote currency.
     */
    public Optional<BestBidAsk> venueBestBidAskUsd(Venue venue) {
        Optional<BestBidAsk> best = getVenueBook(venue).bestBidAskPrices();
        if (best.isEmpty()) {
            return best;
        }
        QuoteCurrency quote = venue.getQuoteCurrency();
        BestBidAsk prices = best.get();
        return Optional.of(new BestBidAsk(
            usdConverter.convert(quote, prices.bid()),
            usdConverter.convert(quote, prices.ask())
        ));
    }

    /**
     * Records the latency of one applied event, from feed receipt to book apply.
     */
    public void updateMetrics(Venue venue, double latencyMs) {
        VenueSlot slot = requireSlot(venue);
        slot.metrics.recordLatency(latencyMs);
        metrics.recordFeedLatency(venue, latencyMs);
    }

    public void recordReconnect(Venue venue) {
        requireSlot(venue).metrics.recordReconnect();
    }

    public AggregatedBookView getAggregatedOrderbook() {
        return aggregated;
    }

    public VenueBookView getVenueBook(Venue venue) {
        return requireSlot(venue).book;
    }

    /**
     * Per-venue statistics for every registered venue.
     */
    public Map<Venue, VenueMetrics> getMetrics() {
        Map<Venue, VenueMetrics> result = new EnumMap<>(Venue.class);
        for (VenueSlot slot : slots.values()) {
            result.put(slot.venue, slot.metrics);
        }
        return Collections.unmodifiableMap(result);
    }

    public VenueState getState(Venue venue) {
        VenueSlot slot = slots.get(venue);
        return slot == null ? VenueState.UNREGISTERED : slot.state;
    }

    public Set<Venue> registeredVenues() {
        Set<Venue> venues = EnumSet.noneOf(Venue.class);
        venues.addAll(slots.keySet());
        return Collections.unmodifiableSet(venues);
    }

    public UsdConverter getUsdConverter() {
        return usdConverter;
    }

    public QuoteCurrency getAggregateCurrency() {
        return aggregateCurrency;
    }

    /**
     * Sets the listener notified when the aggregated book becomes crossed.
     */
    public void setCrossedBookListener(Consumer<CrossedBook> listener) {
        this.crossedBookListener = listener;
    }

    private VenueSlot requireSlot(Venue venue) {
        VenueSlot slot = venue == null ? null : slots.get(venue);
        if (slot == null) {
            throw unknownVenue(venue);
        }
        return slot;
    }

    /**
     * Looks up a venue and takes its writer lock. The caller unlocks.
     */
    private VenueSlot acquire(Venue venue) {
        VenueSlot slot = requireSlot(venue);
        slot.writeLock.lock();
        if (slot.removed) {
            slot.writeLock.unlock();
            throw unknownVenue(venue);
        }
        return slot;
    }

    private UnknownVenueException unknownVenue(Venue venue) {
        metrics.recordRejected(venue, REASON_UNKNOWN_VENUE);
        LOGGER.warn("Dropping update for unregistered venue {}", venue);
        return new UnknownVenueException(venue);
    }

    private void resetLocked(VenueSlot slot) {
        slot.book.clear();
        aggregated.clearVenue(slot.venue);
        slot.metrics.recordResync();
        slot.metrics.recordBestPrices(Double.NaN, Double.NaN);
        metrics.recordResync(slot.venue);
        metrics.setBestPrices(slot.venue, Double.NaN, Double.NaN);
        transition(slot, VenueState.REGISTERED);
    }

    /**
     * Checks that every resting level of a snapshot, once on the venue grid, also fits the
     * aggregate grid. Runs before the venue book is touched.
     */
    private void checkAggregateGrid(VenueSlot slot, List<QuoteLevel> levels) {
        if (levels == null) {
            return;
        }
        PriceGrid venueGrid = slot.book.grid();
        for (QuoteLevel level : levels) {
            if (level == null || level.isDelete()) {
                continue;
            }
            aggregated.toTicks(venueGrid.toPrice(venueGrid.toTicks(level.price())), slot.venue);
        }
    }

    private List<VenueSlot> lockAll() {
        List<VenueSlot> locked = new ArrayList<>();
        for (Venue venue : Venue.values()) {
            VenueSlot slot = slots.get(venue);
            if (slot == null) {
                continue;
            }
            slot.writeLock.lock();
            if (slot.removed) {
                slot.writeLock.unlock();
                continue;
            }
            locked.add(slot);
        }
        return locked;
    }

    private void unlockAll(List<VenueSlot> locked) {
        for (int i = locked.size() - 1; i >= 0; i--) {
            locked.get(i).writeLock.unlock();
        }
    }

    private void rebuildLocked(List<VenueSlot> locked) {
        Map<Venue, BookDepth<PriceLevel>> depths = new EnumMap<>(Venue.class);
        for (VenueSlot slot : locked) {
            depths.put(slot.venue, slot.book.getDepthWithPrices(aggregationDepth));
        }
        aggregated.rebuild(depths);
    }

    private void recordBestPrices(VenueSlot slot) {
        double bid = slot.book.bestBid().map(PriceLevel::price).orElse(Double.NaN);
        double ask = slot.book.bestAsk().map(PriceLevel::price).orElse(Double.NaN);
        slot.metrics.recordBestPrices(bid, ask);
        metrics.setBestPrices(slot.venue, bid, ask);
    }

    private void transition(VenueSlot slot, VenueState next) {
        VenueState previous = slot.state;
        slot.state = next;
        metrics.setVenueState(slot.venue, next);
        if (previous != next) {
            LOGGER.debug("[{}] {} -> {}", slot.venue, previous, next);
        }
    }

    private void afterAggregateMutation() {
        metrics.setLevelCounts(aggregated.levelCount(true), aggregated.levelCount(false));

        Optional<CrossedBook> crossedBook = aggregated.crossedBook();
        if (crossedBook.isEmpty()) {
            crossed.set(false);
            return;
        }
        if (crossed.compareAndSet(false, true)) {
            CrossedBook book = crossedBook.get();
            metrics.recordCrossedBook();
            LOGGER.warn("Aggregated book crossed: bid {} ({}) >= ask {} ({})",
                book.bestBid(), book.bidVenues(), book.bestAsk(), book.askVenues());
            Consumer<CrossedBook> listener = crossedBookListener;
            if (listener != null) {
                listener.accept(book);
            }
        }
    }

    private static final class VenueSlot {
        private final Venue venue;
        private final VenueMetrics metrics;
        private final ReentrantLock writeLock = new ReentrantLock();
        private volatile VenueBook book;
        private volatile VenueState state = VenueState.UNREGISTERED;
        private volatile boolean removed;

        private VenueSlot(Venue venue, VenueBook book) {
            this.venue = venue;
            this.book = book;
            this.metrics = new VenueMetrics(venue);
        }
    }
}
