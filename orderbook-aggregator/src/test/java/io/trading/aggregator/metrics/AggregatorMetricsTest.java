package io.trading.aggregator.metrics;

import io.prometheus.client.CollectorRegistry;
import io.trading.aggregator.core.VenueState;
import io.trading.orderbook.model.Venue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AggregatorMetrics.
 */
class AggregatorMetricsTest {

    private CollectorRegistry registry;
    private AggregatorMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new CollectorRegistry();
        metrics = new AggregatorMetrics(registry);
    }

    @Test
    void testCountersAreLabelledByVenue() {
        metrics.recordUpdateApplied(Venue.BINANCE_SPOT);
        metrics.recordUpdateApplied(Venue.BINANCE_SPOT);
        metrics.recordUpdateApplied(Venue.OKX_SPOT);

        assertEquals(2.0, registry.getSampleValue("aggregator_updates_applied_total",
            new String[]{"venue"}, new String[]{"BINANCE_SPOT"}));
        assertEquals(1.0, metrics.getUpdatesApplied(Venue.OKX_SPOT));
    }

    @Test
    void testRejectionWithoutVenue() {
        metrics.recordRejected(null, "unknown_venue");

        assertEquals(1.0, registry.getSampleValue("aggregator_rejected_updates_total",
            new String[]{"venue", "reason"}, new String[]{AggregatorMetrics.UNKNOWN_VENUE_LABEL, "unknown_venue"}));
    }

    @Test
    void testGauges() {
        metrics.setBestPrices(Venue.BYBIT_SPOT, 100.5, 101.0);
        metrics.setVenueState(Venue.BYBIT_SPOT, VenueState.LIVE);
        metrics.setLevelCounts(12, 7);

        assertEquals(100.5, registry.getSampleValue("aggregator_best_bid",
            new String[]{"venue"}, new String[]{"BYBIT_SPOT"}));
        assertEquals(3.0, registry.getSampleValue("aggregator_venue_state",
            new String[]{"venue"}, new String[]{"BYBIT_SPOT"}));
        assertEquals(7.0, registry.getSampleValue("aggregator_levels",
            new String[]{"side"}, new String[]{"ask"}));
    }

    @Test
    void testLatencySummary() {
        metrics.recordFeedLatency(Venue.OKX_SPOT, 4.0);
        metrics.recordFeedLatency(Venue.OKX_SPOT, 6.0);

        assertEquals(2.0, registry.getSampleValue("aggregator_update_latency_milliseconds_count",
            new String[]{"venue"}, new String[]{"OKX_SPOT"}));
        assertEquals(10.0, registry.getSampleValue("aggregator_update_latency_milliseconds_sum",
            new String[]{"venue"}, new String[]{"OKX_SPOT"}));
    }

    @Test
    void testSeparateRegistriesDoNotClash() {
        AggregatorMetrics other = new AggregatorMetrics(new CollectorRegistry());
        other.recordCrossedBook();

        assertEquals(0.0, metrics.getCrossedBookCount());
        assertEquals(1.0, other.getCrossedBookCount());
    }
}
