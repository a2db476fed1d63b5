package com.foliovault.pricing.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Pricing configuration. Documented in application.yml under foliovault.pricing.
 */
@ConfigurationProperties(prefix = "foliovault.pricing")
@Getter
@Setter
public class PricingProperties {

    /**
     * CoinGecko API base URL (free: https://api.coingecko.com/api/v3).
     */
    private String coingeckoBaseUrl = "https://api.coingecko.com/api/v3";

    /**
     * Requests per minute allowed towards CoinGecko.
     */
    private int coingeckoRequestsPerMinute = 30;

    /**
     * How long a caller waits for a rate-limit permit before the quote is reported invalid.
     */
    private int rateLimitWaitSeconds = 2;

    /**
     * Read timeout in seconds for a CoinGecko call.
     */
    private int readTimeoutSeconds = 5;

    /**
     * Attempts per quote (1 = no retry). Quotes are fetched inside a ledger transition, keep this small.
     */
    private int maxAttempts = 2;

    /**
     * Base backoff between attempts, milliseconds.
     */
    private long retryBaseDelayMs = 200;

    /**
     * Decimals of the fixed-point price handed to valuation (8 = 1 USD is 100000000).
     */
    private int priceDecimals = 8;

    /**
     * Asset symbol -> CoinGecko coin id (e.g. ETH -> ethereum).
     */
    private Map<String, String> symbolToCoinGeckoId = new HashMap<>();

    /**
     * Asset symbol -> fixed-point price served by the "static" source.
     */
    private Map<String, BigInteger> staticPrices = new HashMap<>();
}
