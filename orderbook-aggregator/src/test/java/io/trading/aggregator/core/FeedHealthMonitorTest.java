package io.trading.aggregator.core;

import io.trading.orderbook.model.QuoteLevel;
import io.trading.orderbook.model.Venue;
import org.agrona.concurrent.CachedEpochClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FeedHealthMonitor.
 */
class FeedHealthMonitorTest {

    private static final long STALE_AFTER_MS = 30_000;

    private BookManager manager;
    private CachedEpochClock clock;
    private FeedHealthMonitor monitor;
    private List<Venue> staleVenues;

    @BeforeEach
    void setUp() {
        manager = new BookManager(2);
        manager.addVenue(Venue.BINANCE_SPOT, 2);
        manager.addVenue(Venue.OKX_SPOT, 2);

        clock = new CachedEpochClock();
        clock.update(System.currentTimeMillis());
        monitor = new FeedHealthMonitor(manager, 1000, STALE_AFTER_MS, clock);
        staleVenues = new ArrayList<>();
        monitor.setStaleFeedHandler(staleVenues::add);
    }

    @AfterEach
    void tearDown() {
        monitor.close();
    }

    @Test
    void testFreshVenueIsLeftAlone() {
        manager.applySnapshot(Venue.BINANCE_SPOT, List.of(QuoteLevel.of(100.00, 1)), List.of());

        monitor.performHealthCheck();

        assertEquals(VenueState.SNAPSHOTTED, manager.getState(Venue.BINANCE_SPOT));
        assertTrue(staleVenues.isEmpty());
        assertNull(monitor.getStats(Venue.BINANCE_SPOT));
    }

    @Test
    void testSilentVenueIsReset() {
        manager.applySnapshot(Venue.BINANCE_SPOT, List.of(QuoteLevel.of(100.00, 1)), List.of());
        manager.updateOrderbook(Venue.BINANCE_SPOT, 99.00, 1.0, true);

        clock.update(System.currentTimeMillis() + STALE_AFTER_MS + 1_000);
        monitor.performHealthCheck();

        assertEquals(VenueState.REGISTERED, manager.getState(Venue.BINANCE_SPOT));
        assertTrue(manager.getAggregatedOrderbook().bestBid().isEmpty());
        assertEquals(List.of(Venue.BINANCE_SPOT), staleVenues);
        assertEquals(1, monitor.getStats(Venue.BINANCE_SPOT).getStaleCount());
    }

    @Test
    void testUnsyncedVenueIsNotReset() {
        clock.update(System.currentTimeMillis() + STALE_AFTER_MS * 10);

        monitor.performHealthCheck();

        assertEquals(VenueState.REGISTERED, manager.getState(Venue.OKX_SPOT));
        assertTrue(staleVenues.isEmpty());
    }

    @Test
    void testStartAndStop() {
        monitor.start();
        monitor.start();
        monitor.stop();
    }
}
