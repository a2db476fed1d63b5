package com.foliovault.pricing;

/**
 * Price source that a symbol can be bound to with setPriceFeedSource.
 */
public interface PriceOracle {

    /**
     * Identifier used in price-feed bindings (e.g. "coingecko").
     */
    String sourceId();

    /**
     * Latest price for the symbol. Never throws for missing data; returns an invalid quote instead.
     */
    OracleQuote latestPrice(String symbol);
}
