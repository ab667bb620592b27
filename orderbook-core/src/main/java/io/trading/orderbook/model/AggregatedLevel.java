package io.trading.orderbook.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable copy of one aggregated price level with venue attribution.
 *
 * @param ticks   Quantized price key on the aggregate grid
 * @param price   Price on the aggregate axis
 * @param size    Sum of all venue contributions
 * @param sources Size contributed by each venue quoting this level
 */
public record AggregatedLevel(
    long ticks,
    double price,
    BigDecimal size,
    Map<Venue, BigDecimal> sources
) implements BookLevel {
    public AggregatedLevel {
        if (size == null) {
            throw new IllegalArgumentException("size cannot be null");
        }
        if (sources == null || sources.isEmpty()) {
            throw new IllegalArgumentException("sources cannot be null or empty");
        }
        sources = Collections.unmodifiableMap(new EnumMap<>(sources));
    }

    /**
     * Size contributed by the given venue, zero if it does not quote this level.
     */
    public BigDecimal sizeFrom(Venue venue) {
        return sources.getOrDefault(venue, BigDecimal.ZERO);
    }

    public boolean hasSource(Venue venue) {
        return sources.containsKey(venue);
    }
}
