package com.foliovault.pricing;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Oracle answer for a symbol: fixed-point integer price plus the oracle's own validity flag.
 */
public record OracleQuote(BigInteger price, boolean valid, Instant observedAt) {

    public static OracleQuote of(BigInteger price, Instant observedAt) {
        return new OracleQuote(price, price != null, observedAt);
    }

    public static OracleQuote invalid(Instant observedAt) {
        return new OracleQuote(BigInteger.ZERO, false, observedAt);
    }

    /**
     * Usable for valuation: flagged valid and strictly positive.
     */
    public boolean isUsable() {
        return valid && price != null && price.signum() > 0;
    }
}
