package io.trading.orderbook.model;

import io.trading.orderbook.error.InvalidPriceException;

import java.math.BigDecimal;

/**
 * Raw price level as delivered by a venue feed, before quantization.
 * A size of zero or less is a delete signal, never a stored state.
 *
 * @param price Venue-native price
 * @param size  Absolute resting size at that price
 */
public record QuoteLevel(
    double price,
    BigDecimal size
) {
    public QuoteLevel {
        if (size == null) {
            throw new IllegalArgumentException("size cannot be null");
        }
    }

    public static QuoteLevel of(double price, double size) {
        return new QuoteLevel(price, sizeOf(size));
    }

    /**
     * Converts a floating size to the exact decimal books store.
     *
     * @throws InvalidPriceException if the size is NaN or infinite
     */
    public static BigDecimal sizeOf(double size) {
        if (!Double.isFinite(size)) {
            throw new InvalidPriceException("size must be finite: " + size);
        }
        return BigDecimal.valueOf(size);
    }

    /**
     * Parses a level from the string pair most venues use on the wire,
     * e.g. {@code ["43250.50", "1.25"]}.
     *
     * @throws InvalidPriceException if either value is not a number
     */
    public static QuoteLevel parse(String price, String size) {
        if (price == null || size == null) {
            throw new InvalidPriceException("price and size cannot be null");
        }
        try {
            return new QuoteLevel(Double.parseDouble(price.trim()), new BigDecimal(size.trim()));
        } catch (NumberFormatException e) {
            throw new InvalidPriceException("Unparsable level [" + price + ", " + size + "]", e);
        }
    }

    /**
     * Returns true if this level removes the price rather than resting size at it.
     */
    public boolean isDelete() {
        return size.signum() <= 0;
    }
}
