package io.trading.orderbook.model;

/**
 * Supported venues (exchange markets) contributing to the aggregated book.
 * The constant is the attribution key inside {@code AggregatedBook}.
 */
public enum Venue {
    BINANCE_SPOT("Binance Spot", QuoteCurrency.USDT),
    BINANCE_USDM("Binance USD-M", QuoteCurrency.USDT),
    BINANCE_COINM("Binance COIN-M", QuoteCurrency.USD),
    OKX_SPOT("OKX Spot", QuoteCurrency.USDT),
    BYBIT_SPOT("Bybit Spot", QuoteCurrency.USDT),
    BYBIT_PERP("Bybit Perp", QuoteCurrency.USDT);

    private final String displayName;
    private final QuoteCurrency quoteCurrency;

    Venue(String displayName, QuoteCurrency quoteCurrency) {
        this.displayName = displayName;
        this.quoteCurrency = quoteCurrency;
    }

    public String getDisplayName() {
        return displayName;
    }

    public QuoteCurrency getQuoteCurrency() {
        return quoteCurrency;
    }

    /**
     * Parses a venue from its configuration name, e.g. "binance_spot" or "OKX_SPOT".
     */
    public static Venue fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("venue name cannot be null or empty");
        }
        return Venue.valueOf(name.trim().toUpperCase().replace('-', '_'));
    }

    @Override
    public String toString() {
        return displayName;
    }
}
