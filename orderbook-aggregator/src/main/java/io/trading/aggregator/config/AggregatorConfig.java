package io.trading.aggregator.config;

import io.trading.orderbook.model.QuoteCurrency;
import io.trading.orderbook.model.Venue;
import io.trading.orderbook.price.PriceGrid;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configuration for the order book aggregator.
 *
 * @param aggregatorId      Unique aggregator instance identifier
 * @param venueConfigs      Venues to register, in registration order
 * @param aggregatePrecision Decimal digits of the aggregated book's price grid
 * @param aggregationDepth  Levels per venue folded into the aggregate on snapshot and resync, 0 = all
 * @param aggregateCurrency Currency of the aggregated price axis
 * @param normalizeQuotes   Convert venue quotes onto the aggregate currency using USD rates
 * @param rateTtlMs         Maximum age of a cached USD rate
 * @param staleFeedMs       Feed silence after which a live venue is reset
 * @param healthCheckMs     Health check interval in milliseconds
 * @param sequencerCapacity Capacity of the update sequencer queue
 * @param metricsPort       Port for the metrics and status HTTP server
 */
public record AggregatorConfig(
    String aggregatorId,
    List<VenueConfig> venueConfigs,
    int aggregatePrecision,
    int aggregationDepth,
    QuoteCurrency aggregateCurrency,
    boolean normalizeQuotes,
    long rateTtlMs,
    long staleFeedMs,
    int healthCheckMs,
    int sequencerCapacity,
    int metricsPort
) {
    private static final String DEFAULT_VENUES = "binance_spot:8;okx_spot:8;bybit_spot:8";
    private static final int DEFAULT_AGGREGATE_PRECISION = 8;
    private static final int DEFAULT_AGGREGATION_DEPTH = 0;
    private static final long DEFAULT_RATE_TTL_MS = 60_000;
    private static final long DEFAULT_STALE_FEED_MS = 30_000;
    private static final int DEFAULT_HEALTH_CHECK_MS = 5000;
    private static final int DEFAULT_SEQUENCER_CAPACITY = 65_536;
    private static final int DEFAULT_METRICS_PORT = 9090;

    public AggregatorConfig {
        if (aggregatorId == null || aggregatorId.isEmpty()) {
            throw new IllegalArgumentException("aggregatorId cannot be null or empty");
        }
        if (venueConfigs == null || venueConfigs.isEmpty()) {
            throw new IllegalArgumentException("venueConfigs cannot be null or empty");
        }
        Set<Venue> seen = new HashSet<>();
        for (VenueConfig venueConfig : venueConfigs) {
            if (!seen.add(venueConfig.venue())) {
                throw new IllegalArgumentException("duplicate venue: " + venueConfig.venue().name());
            }
        }
        venueConfigs = List.copyOf(venueConfigs);
        if (aggregatePrecision < 0 || aggregatePrecision > PriceGrid.MAX_PRECISION) {
            throw new IllegalArgumentException("aggregatePrecision must be between 0 and " + PriceGrid.MAX_PRECISION);
        }
        if (aggregationDepth < 0) {
            throw new IllegalArgumentException("aggregationDepth cannot be negative");
        }
        if (aggregateCurrency == null) {
            throw new IllegalArgumentException("aggregateCurrency cannot be null");
        }
        if (rateTtlMs <= 0) {
            throw new IllegalArgumentException("rateTtlMs must be positive");
        }
        if (staleFeedMs <= 0) {
            throw new IllegalArgumentException("staleFeedMs must be positive");
        }
        if (healthCheckMs <= 0) {
            throw new IllegalArgumentException("healthCheckMs must be positive");
        }
        if (sequencerCapacity < 2) {
            throw new IllegalArgumentException("sequencerCapacity must be at least 2");
        }
        if (metricsPort < 1 || metricsPort > 65535) {
            throw new IllegalArgumentException("metricsPort must be between 1 and 65535");
        }
    }

    /**
     * Loads configuration from environment variables.
     *
     * Environment variables:
     * - AGGREGATOR_ID: Instance ID (default: "aggregator-0")
     * - VENUES: Venue configs (e.g., "binance_spot:8;okx_spot:8;bybit_spot:8")
     * - AGGREGATE_PRECISION: Aggregate grid digits (default: 8)
     * - AGGREGATION_DEPTH: Levels per venue folded into the aggregate, 0 = all (default: 0)
     * - AGGREGATE_CURRENCY: Aggregate price axis (default: USDT)
     * - NORMALIZE_QUOTES: Convert venue quotes onto the aggregate axis (default: false)
     * - RATE_TTL_MS: USD rate TTL (default: 60000)
     * - STALE_FEED_MS: Feed silence before a venue is reset (default: 30000)
     * - HEALTH_CHECK_MS: Health check interval (default: 5000)
     * - SEQUENCER_CAPACITY: Update queue capacity (default: 65536)
     * - METRICS_PORT: HTTP port (default: 9090)
     */
    public static AggregatorConfig fromEnv() {
        return fromMap(System.getenv());
    }

    /**
     * Loads configuration from a key/value map using the same keys as {@link #fromEnv()}.
     */
    public static AggregatorConfig fromMap(Map<String, String> values) {
        String aggregatorId = stringValue(values, "AGGREGATOR_ID", "aggregator-0");
        String venuesStr = stringValue(values, "VENUES", DEFAULT_VENUES);

        List<VenueConfig> venueConfigs = Arrays.stream(venuesStr.split(";"))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(VenueConfig::fromString)
            .collect(Collectors.toList());

        QuoteCurrency aggregateCurrency =
            QuoteCurrency.valueOf(stringValue(values, "AGGREGATE_CURRENCY", "USDT").toUpperCase());

        return new AggregatorConfig(
            aggregatorId,
            venueConfigs,
            intValue(values, "AGGREGATE_PRECISION", DEFAULT_AGGREGATE_PRECISION),
            intValue(values, "AGGREGATION_DEPTH", DEFAULT_AGGREGATION_DEPTH),
            aggregateCurrency,
            Boolean.parseBoolean(stringValue(values, "NORMALIZE_QUOTES", "false")),
            longValue(values, "RATE_TTL_MS", DEFAULT_RATE_TTL_MS),
            longValue(values, "STALE_FEED_MS", DEFAULT_STALE_FEED_MS),
            intValue(values, "HEALTH_CHECK_MS", DEFAULT_HEALTH_CHECK_MS),
            intValue(values, "SEQUENCER_CAPACITY", DEFAULT_SEQUENCER_CAPACITY),
            intValue(values, "METRICS_PORT", DEFAULT_METRICS_PORT)
        );
    }

    /**
     * Venue to grid precision, in registration order.
     */
    public Map<Venue, Integer> venuePrecisions() {
        Map<Venue, Integer> precisions = new LinkedHashMap<>();
        for (VenueConfig venueConfig : venueConfigs) {
            precisions.put(venueConfig.venue(), venueConfig.precision());
        }
        return precisions;
    }

    private static String stringValue(Map<String, String> values, String key, String defaultValue) {
        String value = values.get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        return value.trim();
    }

    private static int intValue(Map<String, String> values, String key, int defaultValue) {
        String value = values.get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static long longValue(Map<String, String> values, String key, long defaultValue) {
        String value = values.get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid long for " + key + ": " + value, e);
        }
    }
}
