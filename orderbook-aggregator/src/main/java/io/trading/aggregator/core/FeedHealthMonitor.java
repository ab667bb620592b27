package io.trading.aggregator.core;

import io.trading.orderbook.error.UnknownVenueException;
import io.trading.orderbook.model.Venue;
import org.agrona.concurrent.EpochClock;
import org.agrona.concurrent.SystemEpochClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Watches venue feeds for silence. A synced venue whose last snapshot or update is older
 * than the stale threshold is reset and reported so its feed can resubscribe.
 */
public class FeedHealthMonitor implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(FeedHealthMonitor.class);

    private final BookManager bookManager;
    private final long checkIntervalMs;
    private final long staleAfterMs;
    private final EpochClock clock;
    private final ScheduledExecutorService scheduler;
    private final Map<Venue, FeedStats> statsMap = new ConcurrentHashMap<>();

    private volatile Consumer<Venue> staleFeedHandler;
    private volatile boolean running = false;

    public FeedHealthMonitor(BookManager bookManager, long checkIntervalMs, long staleAfterMs) {
        this(bookManager, checkIntervalMs, staleAfterMs, SystemEpochClock.INSTANCE);
    }

    public FeedHealthMonitor(BookManager bookManager, long checkIntervalMs, long staleAfterMs, EpochClock clock) {
        if (bookManager == null) {
            throw new IllegalArgumentException("bookManager cannot be null");
        }
        if (checkIntervalMs <= 0 || staleAfterMs <= 0) {
            throw new IllegalArgumentException("intervals must be positive");
        }
        this.bookManager = bookManager;
        this.checkIntervalMs = checkIntervalMs;
        this.staleAfterMs = staleAfterMs;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "feed-health-monitor");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Sets the callback invoked after a stale venue has been reset.
     */
    public void setStaleFeedHandler(Consumer<Venue> handler) {
        this.staleFeedHandler = handler;
    }

    /**
     * Starts the health monitor.
     */
    public void start() {
        if (running) {
            return;
        }

        running = true;
        scheduler.scheduleAtFixedRate(
            this::performHealthCheck,
            checkIntervalMs,
            checkIntervalMs,
            TimeUnit.MILLISECONDS
        );

        LOGGER.info("Feed health monitor started (interval: {} ms, stale after: {} ms)", checkIntervalMs, staleAfterMs);
    }

    /**
     * Stops the health monitor.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Feed health monitor stopped");
    }

    /**
     * Checks every registered venue once.
     */
    void performHealthCheck() {
        long now = clock.time();
        for (Map.Entry<Venue, VenueMetrics> entry : bookManager.getMetrics().entrySet()) {
            Venue venue = entry.getKey();
            if (!bookManager.getState(venue).isSynced()) {
                continue;
            }

            long lastUpdate = entry.getValue().getLastUpdateTimeMs();
            if (now - lastUpdate < staleAfterMs) {
                continue;
            }

            try {
                if (!bookManager.resetIfStale(venue, now, staleAfterMs)) {
                    continue;
                }
            } catch (UnknownVenueException e) {
                LOGGER.debug("[FeedHealthMonitor] {} removed before reset", venue);
                continue;
            }
            LOGGER.warn("[FeedHealthMonitor] {} silent for {} ms, reset", venue, now - lastUpdate);
            statsMap.computeIfAbsent(venue, FeedStats::new).recordStale(now);

            Consumer<Venue> handler = staleFeedHandler;
            if (handler != null) {
                handler.accept(venue);
            }
        }
    }

    /**
     * Logs a summary of feed statistics.
     */
    public void logSummary() {
        LOGGER.info("=== Feed Health Summary ===");
        for (Map.Entry<Venue, VenueMetrics> entry : bookManager.getMetrics().entrySet()) {
            Venue venue = entry.getKey();
            VenueMetrics venueMetrics = entry.getValue();
            FeedStats stats = statsMap.get(venue);
            LOGGER.info("{}: state={}, updates={}, snapshots={}, staleCount={}, avgLatency={} ms",
                venue,
                bookManager.getState(venue),
                venueMetrics.getUpdatesProcessed(),
                venueMetrics.getSnapshotsApplied(),
                stats == null ? 0 : stats.getStaleCount(),
                String.format("%.2f", venueMetrics.getAvgLatencyMs())
            );
        }
        LOGGER.info("===========================");
    }

    /**
     * Gets stale feed statistics for a venue, or null if it never went stale.
     */
    public FeedStats getStats(Venue venue) {
        return statsMap.get(venue);
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Stale feed statistics for a venue.
     */
    public static class FeedStats {
        private final Venue venue;
        private volatile long staleCount = 0;
        private volatile long lastStaleTime = 0;

        public FeedStats(Venue venue) {
            this.venue = venue;
        }

        private synchronized void recordStale(long now) {
            staleCount++;
            lastStaleTime = now;
        }

        public Venue getVenue() {
            return venue;
        }

        public long getStaleCount() {
            return staleCount;
        }

        public long getLastStaleTime() {
            return lastStaleTime;
        }
    }
}
