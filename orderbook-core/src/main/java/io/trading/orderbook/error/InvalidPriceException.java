package io.trading.orderbook.error;

/**
 * Thrown when a price cannot be placed on a price grid: non-finite, not positive,
 * out of tick range, or when a grid precision is out of range.
 */
public class InvalidPriceException extends OrderBookException {

    public InvalidPriceException(String message) {
        super(message);
    }

    public InvalidPriceException(String message, Throwable cause) {
        super(message, cause);
    }
}
