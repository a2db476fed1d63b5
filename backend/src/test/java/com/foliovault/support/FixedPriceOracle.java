package com.foliovault.support;

import com.foliovault.pricing.OracleQuote;
import com.foliovault.pricing.PriceOracle;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Oracle under test control. Symbols without a quote answer with an invalid quote.
 */
public class FixedPriceOracle implements PriceOracle {

    private final String sourceId;
    private final Map<String, OracleQuote> quotes = new HashMap<>();

    public FixedPriceOracle(String sourceId) {
        this.sourceId = sourceId;
    }

    public FixedPriceOracle quote(String symbol, OracleQuote quote) {
        quotes.put(symbol, quote);
        return this;
    }

    @Override
    public String sourceId() {
        return sourceId;
    }

    @Override
    public OracleQuote latestPrice(String symbol) {
        return quotes.getOrDefault(symbol, OracleQuote.invalid(Instant.EPOCH));
    }
}
