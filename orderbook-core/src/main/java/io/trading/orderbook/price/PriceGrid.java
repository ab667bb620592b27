package io.trading.orderbook.price;

import io.trading.orderbook.error.InvalidPriceException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-precision price grid.
 *
 * Maps a floating price onto an integer tick key, {@code round_half_up(price * 10^precision)},
 * so that prices from venues with different tick sizes become comparable map keys.
 * Ticks are the only price representation used as a key inside the books.
 */
public final class PriceGrid {

    /**
     * Above 15 decimal digits a double no longer carries the precision the grid promises.
     */
    public static final int MAX_PRECISION = 15;

    private final int precision;
    private final double scale;

    public PriceGrid(int precision) {
        if (precision < 0 || precision > MAX_PRECISION) {
            throw new InvalidPriceException(
                "precision must be between 0 and " + MAX_PRECISION + ": " + precision);
        }
        this.precision = precision;
        this.scale = Math.pow(10, precision);
    }

    public int precision() {
        return precision;
    }

    /**
     * Quantizes a price onto this grid.
     *
     * @throws InvalidPriceException if the price is NaN, infinite, not positive,
     *                               or its tick value does not fit in a long
     */
    public long toTicks(double price) {
        if (!Double.isFinite(price)) {
            throw new InvalidPriceException("price must be finite: " + price);
        }
        if (price <= 0.0) {
            throw new InvalidPriceException("price must be positive: " + price);
        }
        // Double.toString gives the shortest decimal that round-trips, so 0.1 stays 0.1
        BigDecimal scaled = BigDecimal.valueOf(price).setScale(precision, RoundingMode.HALF_UP);
        if (scaled.signum() == 0) {
            throw new InvalidPriceException(
                "price " + price + " rounds to zero at precision " + precision);
        }
        try {
            return scaled.unscaledValue().longValueExact();
        } catch (ArithmeticException e) {
            throw new InvalidPriceException("price out of range at precision " + precision + ": " + price, e);
        }
    }

    /**
     * Converts a tick key back to a price.
     */
    public double toPrice(long ticks) {
        if (precision == 0) {
            return ticks;
        }
        return ticks / scale;
    }

    /**
     * Snaps a price to the nearest grid point.
     */
    public double round(double price) {
        return toPrice(toTicks(price));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return precision == ((PriceGrid) o).precision;
    }

    @Override
    public int hashCode() {
        return precision;
    }

    @Override
    public String toString() {
        return "PriceGrid{precision=" + precision + "}";
    }
}
