package com.foliovault.pricing;

import com.foliovault.pricing.config.PricingProperties;
import com.foliovault.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PriceOracleRegistryTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));

    @Test
    @DisplayName("finds oracles by source id regardless of case")
    void caseInsensitive() {
        PricingProperties props = new PricingProperties();
        StaticPriceOracle staticOracle = new StaticPriceOracle(props, clock);
        PriceOracleRegistry registry = new PriceOracleRegistry(List.of(staticOracle));

        assertThat(registry.find("STATIC")).containsSame(staticOracle);
        assertThat(registry.find(" static ")).containsSame(staticOracle);
        assertThat(registry.find("coingecko")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
        assertThat(registry.sourceIds()).containsExactly("static");
    }

    @Test
    @DisplayName("static oracle serves configured prices, anything else is invalid")
    void staticOracle() {
        PricingProperties props = new PricingProperties();
        props.setStaticPrices(Map.of("USDC", BigInteger.valueOf(100_000_000)));
        StaticPriceOracle oracle = new StaticPriceOracle(props, clock);

        assertThat(oracle.latestPrice("USDC").isUsable()).isTrue();
        assertThat(oracle.latestPrice("USDC").price()).isEqualTo(BigInteger.valueOf(100_000_000));
        assertThat(oracle.latestPrice("ETH").valid()).isFalse();
    }
}
