package io.trading.orderbook.price;

import io.trading.orderbook.error.RateStaleException;
import io.trading.orderbook.model.QuoteCurrency;
import org.agrona.concurrent.NanoClock;
import org.agrona.concurrent.SystemNanoClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;

/**
 * TTL-bounded cache of quote currency to USD rates.
 *
 * A cached rate is served only while it is younger than the TTL. Past that it is
 * treated as absent and {@link #convert} throws {@link RateStaleException}, so the
 * caller has to supply a fresh rate through {@link #updateRate} first. The cache
 * does no I/O and never blocks; fetching rates is the caller's job.
 *
 * Thread-safe.
 */
public class UsdConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(UsdConverter.class);

    private final long ttlNanos;
    private final NanoClock clock;
    private final Map<QuoteCurrency, CachedRate> rates = new ConcurrentHashMap<>();

    private volatile long lastRefreshedNanos = Long.MIN_VALUE;

    public UsdConverter(Duration ttl) {
        this(ttl, SystemNanoClock.INSTANCE);
    }

    public UsdConverter(Duration ttl, NanoClock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.ttlNanos = ttl.toNanos();
        this.clock = clock;
    }

    /**
     * Converts an amount quoted in {@code currency} to USD.
     *
     * @throws RateStaleException if no rate younger than the TTL is cached
     */
    public double convert(QuoteCurrency currency, double amount) {
        if (currency.isUsd()) {
            return amount;
        }
        CachedRate cached = rates.get(currency);
        if (cached == null) {
            throw new RateStaleException(currency, "No USD rate cached for " + currency);
        }
        long ageNanos = clock.nanoTime() - cached.refreshedAtNanos();
        if (ageNanos >= ttlNanos) {
            throw new RateStaleException(currency,
                "USD rate for " + currency + " is stale (age " + ageNanos / 1_000_000 + " ms)");
        }
        return amount * cached.rate();
    }

    /**
     * Stores a fresh rate: one unit of {@code currency} is worth {@code usdRate} USD.
     */
    public void updateRate(QuoteCurrency currency, double usdRate) {
        if (currency == null) {
            throw new IllegalArgumentException("currency cannot be null");
        }
        if (!Double.isFinite(usdRate) || usdRate <= 0.0) {
            throw new IllegalArgumentException("usdRate must be finite and positive: " + usdRate);
        }
        long now = clock.nanoTime();
        CachedRate previous = rates.put(currency, new CachedRate(usdRate, now));
        lastRefreshedNanos = now;
        if (previous == null || previous.rate() != usdRate) {
            LOGGER.debug("USD rate for {} set to {}", currency, usdRate);
        }
    }

    /**
     * Returns true if {@link #convert} would succeed for this currency right now.
     */
    public boolean isFresh(QuoteCurrency currency) {
        return rate(currency).isPresent();
    }

    /**
     * Returns the cached rate if it is still fresh.
     */
    public OptionalDouble rate(QuoteCurrency currency) {
        if (currency.isUsd()) {
            return OptionalDouble.of(1.0);
        }
        CachedRate cached = rates.get(currency);
        if (cached == null || clock.nanoTime() - cached.refreshedAtNanos() >= ttlNanos) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(cached.rate());
    }

    /**
     * Clock reading of the most recent {@link #updateRate}, {@link Long#MIN_VALUE} if none yet.
     */
    public long lastRefreshedNanos() {
        return lastRefreshedNanos;
    }

    public Duration ttl() {
        return Duration.ofNanos(ttlNanos);
    }

    private record CachedRate(double rate, long refreshedAtNanos) {}
}
