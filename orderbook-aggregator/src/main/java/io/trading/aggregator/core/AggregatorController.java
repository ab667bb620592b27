package io.trading.aggregator.core;

import io.trading.aggregator.config.AggregatorConfig;
import io.trading.aggregator.feed.BookEvent;
import io.trading.aggregator.feed.BookUpdateHandler;
import io.trading.aggregator.feed.BookUpdateSequencer;
import io.trading.aggregator.feed.VenueFeed;
import io.trading.aggregator.metrics.AggregatorMetrics;
import io.trading.aggregator.metrics.MetricsServer;
import io.trading.orderbook.error.InvalidPriceException;
import io.trading.orderbook.error.OrderBookException;
import io.trading.orderbook.model.QuoteLevel;
import io.trading.orderbook.model.Venue;
import org.agrona.CloseHelper;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Main controller for the order book aggregator.
 * Wires venue feeds through the update sequencer into the book manager and runs the
 * health monitor and HTTP server.
 */
public class AggregatorController implements AutoCloseable, BookUpdateHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(AggregatorController.class);

    private final AggregatorConfig config;
    private final AggregatorMetrics metrics;
    private final BookManager bookManager;
    private final BookUpdateSequencer sequencer;
    private final FeedHealthMonitor healthMonitor;
    private final MetricsServer metricsServer;
    private final Map<Venue, VenueFeed> feeds;
    private final ShutdownSignalBarrier shutdownBarrier;

    public AggregatorController(AggregatorConfig config) {
        this(config, new AggregatorMetrics());
    }

    public AggregatorController(AggregatorConfig config, AggregatorMetrics metrics) {
        this.config = config;
        this.metrics = metrics;
        this.bookManager = BookManager.fromConfig(config, metrics);
        this.sequencer = new BookUpdateSequencer(bookManager, metrics, config.sequencerCapacity());
        this.healthMonitor = new FeedHealthMonitor(bookManager, config.healthCheckMs(), config.staleFeedMs());
        this.metricsServer = new MetricsServer(config.metricsPort(), metrics, config, bookManager);
        this.feeds = new EnumMap<>(Venue.class);
        this.shutdownBarrier = new ShutdownSignalBarrier();

        sequencer.setRejectionHandler(this::onRejected);
        healthMonitor.setStaleFeedHandler(this::resubscribe);

        LOGGER.info("Aggregator controller initialized: {}", config.aggregatorId());
    }

    /**
     * Attaches a venue feed. The venue must be configured.
     */
    public synchronized void registerFeed(VenueFeed feed) {
        Venue venue = feed.getVenue();
        if (!bookManager.registeredVenues().contains(venue)) {
            throw new IllegalArgumentException("Venue not configured: " + venue.name());
        }
        feed.setUpdateHandler(this);
        feeds.put(venue, feed);
        LOGGER.info("Registered feed for {}", venue);
    }

    /**
     * Starts the aggregator and connects all registered feeds.
     */
    public void start() throws IOException {
        LOGGER.info("Starting Order Book Aggregator...");

        sequencer.start();
        healthMonitor.start();
        metricsServer.start();

        for (VenueFeed feed : feedsSnapshot()) {
            feed.connect();
            LOGGER.info("Started feed for {}", feed.getVenue());
        }

        LOGGER.info("Order Book Aggregator started successfully");
        logStatus();
    }

    /**
     * Waits for shutdown signal.
     */
    public void waitForShutdown() {
        LOGGER.info("Aggregator running. Press Ctrl+C to shutdown.");
        shutdownBarrier.await();

        LOGGER.info("Shutdown signal received");
    }

    /**
     * Stops the aggregator gracefully.
     */
    public void shutdown() {
        LOGGER.info("Shutting down Order Book Aggregator...");

        for (VenueFeed feed : feedsSnapshot()) {
            try {
                feed.close();
            } catch (Exception e) {
                LOGGER.error("Error closing feed for {}", feed.getVenue(), e);
            }
        }
        synchronized (this) {
            feeds.clear();
        }
        CloseHelper.closeAll(sequencer, healthMonitor, metricsServer);

        LOGGER.info("Order Book Aggregator shutdown complete");
    }

    @Override
    public void close() {
        shutdown();
    }

    @Override
    public void onSnapshot(Venue venue, List<QuoteLevel> bids, List<QuoteLevel> asks) {
        sequencer.offer(BookEvent.snapshot(venue, bids, asks));
    }

    @Override
    public void onLevelUpdate(Venue venue, double price, BigDecimal size, boolean isBid) {
        if (!sequencer.offer(BookEvent.levelUpdate(venue, price, size, isBid))) {
            // a dropped incremental update leaves the venue book behind the venue
            if (sequencer.offer(BookEvent.reset(venue))) {
                resubscribe(venue);
            }
        }
    }

    @Override
    public void onDisconnect(Venue venue) {
        LOGGER.warn("[{}] Feed disconnected", venue);
        sequencer.offer(BookEvent.reset(venue));
        bookManager.recordReconnect(venue);
    }

    private void onRejected(BookEvent event, OrderBookException e) {
        if (e instanceof InvalidPriceException && event.type() == BookEvent.Type.LEVEL_UPDATE) {
            LOGGER.debug("[{}] Ignored update with invalid price {}", event.venue(), event.price());
            return;
        }
        LOGGER.warn("[{}] {} event rejected: {}", event.venue(), event.type(), e.getMessage());
    }

    /**
     * Reconnects a venue feed so that it starts over with a snapshot.
     */
    private void resubscribe(Venue venue) {
        VenueFeed feed;
        synchronized (this) {
            feed = feeds.get(venue);
        }
        if (feed == null) {
            return;
        }
        LOGGER.info("[{}] Resubscribing feed", venue);
        feed.disconnect();
        feed.connect();
        bookManager.recordReconnect(venue);
    }

    private synchronized List<VenueFeed> feedsSnapshot() {
        return List.copyOf(feeds.values());
    }

    /**
     * Logs current aggregator status.
     */
    public void logStatus() {
        LOGGER.info("=== Aggregator Status ===");
        LOGGER.info("Aggregator ID: {}", config.aggregatorId());
        LOGGER.info("Aggregate precision: {}", config.aggregatePrecision());
        LOGGER.info("Aggregate currency: {} (normalize: {})", config.aggregateCurrency(), config.normalizeQuotes());
        LOGGER.info("Sequencer: queued={}, processed={}, errors={}",
            sequencer.queueSize(), sequencer.getProcessedCount(), sequencer.getErrorCount());
        for (Venue venue : bookManager.registeredVenues()) {
            VenueFeed feed;
            synchronized (this) {
                feed = feeds.get(venue);
            }
            LOGGER.info("{}: state={}, feed={}",
                venue,
                bookManager.getState(venue),
                feed == null ? "none" : (feed.isConnected() ? "connected" : "disconnected")
            );
        }
        healthMonitor.logSummary();
        LOGGER.info("=========================");
    }

    public BookManager getBookManager() {
        return bookManager;
    }

    public BookUpdateSequencer getSequencer() {
        return sequencer;
    }

    public AggregatorMetrics getMetrics() {
        return metrics;
    }

    /**
     * Gets the shutdown barrier for external signal handling.
     */
    public ShutdownSignalBarrier getShutdownBarrier() {
        return shutdownBarrier;
    }
}
