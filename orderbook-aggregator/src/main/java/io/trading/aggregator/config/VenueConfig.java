package io.trading.aggregator.config;

import io.trading.orderbook.model.Venue;
import io.trading.orderbook.price.PriceGrid;

/**
 * Configuration for a single venue.
 *
 * @param venue     The venue identifier
 * @param precision Decimal digits of the venue book's price grid
 */
public record VenueConfig(
    Venue venue,
    int precision
) {
    public VenueConfig {
        if (venue == null) {
            throw new IllegalArgumentException("venue cannot be null");
        }
        if (precision < 0 || precision > PriceGrid.MAX_PRECISION) {
            throw new IllegalArgumentException("precision must be between 0 and " + PriceGrid.MAX_PRECISION);
        }
    }

    /**
     * Parses a venue configuration string.
     * Format: "venue:precision"
     * Example: "binance_spot:8"
     */
    public static VenueConfig fromString(String value) {
        String[] parts = value.split(":");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid venue config format: " + value);
        }

        Venue venue = Venue.fromName(parts[0]);
        int precision;
        try {
            precision = Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid precision in venue config: " + value, e);
        }

        return new VenueConfig(venue, precision);
    }

    @Override
    public String toString() {
        return venue.name().toLowerCase() + ":" + precision;
    }
}
