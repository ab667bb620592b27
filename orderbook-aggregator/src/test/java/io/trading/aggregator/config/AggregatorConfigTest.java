package io.trading.aggregator.config;

import io.trading.orderbook.model.QuoteCurrency;
import io.trading.orderbook.model.Venue;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AggregatorConfig and VenueConfig.
 */
class AggregatorConfigTest {

    @Test
    void testDefaults() {
        AggregatorConfig config = AggregatorConfig.fromMap(Map.of());

        assertEquals("aggregator-0", config.aggregatorId());
        assertEquals(List.of(
            new VenueConfig(Venue.BINANCE_SPOT, 8),
            new VenueConfig(Venue.OKX_SPOT, 8),
            new VenueConfig(Venue.BYBIT_SPOT, 8)
        ), config.venueConfigs());
        assertEquals(8, config.aggregatePrecision());
        assertEquals(0, config.aggregationDepth());
        assertEquals(QuoteCurrency.USDT, config.aggregateCurrency());
        assertFalse(config.normalizeQuotes());
        assertEquals(60_000, config.rateTtlMs());
        assertEquals(30_000, config.staleFeedMs());
        assertEquals(5000, config.healthCheckMs());
        assertEquals(65_536, config.sequencerCapacity());
        assertEquals(9090, config.metricsPort());
    }

    @Test
    void testOverrides() {
        AggregatorConfig config = AggregatorConfig.fromMap(Map.of(
            "AGGREGATOR_ID", "agg-7",
            "VENUES", "binance_coinm:1; okx-spot:4",
            "AGGREGATE_PRECISION", "2",
            "AGGREGATION_DEPTH", "50",
            "AGGREGATE_CURRENCY", "usd",
            "NORMALIZE_QUOTES", "true",
            "METRICS_PORT", "9191"
        ));

        assertEquals("agg-7", config.aggregatorId());
        assertEquals(Map.of(Venue.BINANCE_COINM, 1, Venue.OKX_SPOT, 4), config.venuePrecisions());
        assertEquals(List.of(Venue.BINANCE_COINM, Venue.OKX_SPOT), List.copyOf(config.venuePrecisions().keySet()));
        assertEquals(2, config.aggregatePrecision());
        assertEquals(50, config.aggregationDepth());
        assertEquals(QuoteCurrency.USD, config.aggregateCurrency());
        assertTrue(config.normalizeQuotes());
        assertEquals(9191, config.metricsPort());
    }

    @Test
    void testVenueConfigParsing() {
        VenueConfig config = VenueConfig.fromString("bybit_perp:3");

        assertEquals(Venue.BYBIT_PERP, config.venue());
        assertEquals(3, config.precision());
        assertEquals("bybit_perp:3", config.toString());

        assertThrows(IllegalArgumentException.class, () -> VenueConfig.fromString("bybit_perp"));
        assertThrows(IllegalArgumentException.class, () -> VenueConfig.fromString("bybit_perp:x"));
        assertThrows(IllegalArgumentException.class, () -> VenueConfig.fromString("nowhere:2"));
        assertThrows(IllegalArgumentException.class, () -> VenueConfig.fromString("bybit_perp:16"));
    }

    @Test
    void testInvalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> AggregatorConfig.fromMap(Map.of("VENUES", "binance_spot:8;binance_spot:2")));
        assertThrows(IllegalArgumentException.class,
            () -> AggregatorConfig.fromMap(Map.of("AGGREGATE_PRECISION", "-1")));
        assertThrows(IllegalArgumentException.class,
            () -> AggregatorConfig.fromMap(Map.of("AGGREGATION_DEPTH", "-5")));
        assertThrows(IllegalArgumentException.class,
            () -> AggregatorConfig.fromMap(Map.of("RATE_TTL_MS", "0")));
        assertThrows(IllegalArgumentException.class,
            () -> AggregatorConfig.fromMap(Map.of("METRICS_PORT", "abc")));
        assertThrows(IllegalArgumentException.class,
            () -> AggregatorConfig.fromMap(Map.of("AGGREGATE_CURRENCY", "EUR")));
        assertThrows(IllegalArgumentException.class,
            () -> AggregatorConfig.fromMap(Map.of("VENUES", " ; ")));
    }
}
