package io.trading.orderbook.error;

import io.trading.orderbook.model.QuoteCurrency;

/**
 * Thrown when a USD conversion is requested and no rate younger than the
 * configured TTL is cached. The caller retries after refreshing the rate.
 */
public class RateStaleException extends OrderBookException {

    private final QuoteCurrency currency;

    public RateStaleException(QuoteCurrency currency, String message) {
        super(message);
        this.currency = currency;
    }

    public QuoteCurrency getCurrency() {
        return currency;
    }
}
