package io.trading.orderbook.error;

/**
 * Base type of all recoverable order book errors. None of them is fatal:
 * the caller (usually a feed adapter) decides whether to resync the venue.
 */
public abstract class OrderBookException extends RuntimeException {

    protected OrderBookException(String message) {
        super(message);
    }

    protected OrderBookException(String message, Throwable cause) {
        super(message, cause);
    }
}
