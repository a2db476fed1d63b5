package com.foliovault.pricing;

import com.foliovault.pricing.config.PricingProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;

/**
 * Fixed prices from configuration (foliovault.pricing.static-prices). Useful for local runs and fixtures.
 */
@Component
@RequiredArgsConstructor
public class StaticPriceOracle implements PriceOracle {

    public static final String SOURCE_ID = "static";

    private final PricingProperties pricingProperties;
    private final Clock clock;

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    @Override
    public OracleQuote latestPrice(String symbol) {
        BigInteger price = symbol == null ? null : pricingProperties.getStaticPrices().get(symbol);
        if (price == null) {
            return OracleQuote.invalid(clock.instant());
        }
        return OracleQuote.of(price, clock.instant());
    }
}
