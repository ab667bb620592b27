package io.trading.orderbook.model;

/**
 * Currencies a venue can quote its prices in.
 */
public enum QuoteCurrency {
    USD,
    USDT,
    USDC;

    /**
     * Returns true if prices in this currency are already USD-denominated.
     */
    public boolean isUsd() {
        return this == USD;
    }
}
