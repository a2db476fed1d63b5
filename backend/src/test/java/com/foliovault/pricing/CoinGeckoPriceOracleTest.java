package com.foliovault.pricing;

import com.foliovault.common.RetryPolicy;
import com.foliovault.pricing.config.PricingProperties;
import com.foliovault.support.MutableClock;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CoinGeckoPriceOracleTest {

    private PricingProperties props;
    private MutableClock clock;
    private AtomicInteger calls;

    @BeforeEach
    void setUp() {
        props = new PricingProperties();
        props.setCoingeckoBaseUrl("https://api.coingecko.com/api/v3");
        props.setSymbolToCoinGeckoId(Map.of("ETH", "ethereum"));
        props.setPriceDecimals(8);
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        calls = new AtomicInteger();
    }

    private CoinGeckoPriceOracle oracle(HttpStatus status, String body, int maxAttempts) {
        WebClient.Builder webClientBuilder = WebClient.builder()
                .exchangeFunction(req -> {
                    calls.incrementAndGet();
                    return Mono.just(ClientResponse.create(status)
                            .header("Content-Type", "application/json")
                            .body(body)
                            .build());
                });
        RateLimiter limiter = RateLimiter.of("test", RateLimiterConfig.custom()
                .limitForPeriod(100)
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .timeoutDuration(Duration.ZERO)
                .build());
        return new CoinGeckoPriceOracle(props, webClientBuilder, limiter, new RetryPolicy(0L, 0, maxAttempts), clock);
    }

    @Test
    @DisplayName("parseUsdPrice scales to fixed point and truncates extra decimals")
    void parseUsdPrice() {
        Optional<BigInteger> price = CoinGeckoPriceOracle.parseUsdPrice("{\"ethereum\": {\"usd\": 3500.123456789}}", "ethereum", 8);
        assertThat(price).contains(new BigInteger("350012345678"));
    }

    @Test
    @DisplayName("parseUsdPrice returns empty for missing coin, non-numeric price or bad JSON")
    void parseUsdPriceEmpty() {
        assertThat(CoinGeckoPriceOracle.parseUsdPrice("{\"bitcoin\": {\"usd\": 1}}", "ethereum", 8)).isEmpty();
        assertThat(CoinGeckoPriceOracle.parseUsdPrice("{\"ethereum\": {\"usd\": \"n/a\"}}", "ethereum", 8)).isEmpty();
        assertThat(CoinGeckoPriceOracle.parseUsdPrice("not json", "ethereum", 8)).isEmpty();
        assertThat(CoinGeckoPriceOracle.parseUsdPrice(null, "ethereum", 8)).isEmpty();
    }

    @Test
    @DisplayName("latestPrice returns a usable quote stamped with the clock")
    void latestPrice() {
        OracleQuote quote = oracle(HttpStatus.OK, "{\"ethereum\": {\"usd\": 3500.25}}", 1).latestPrice("ETH");

        assertThat(quote.isUsable()).isTrue();
        assertThat(quote.price()).isEqualTo(new BigInteger("350025000000"));
        assertThat(quote.observedAt()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("unmapped symbol is invalid without calling CoinGecko")
    void unmappedSymbol() {
        OracleQuote quote = oracle(HttpStatus.OK, "{}", 1).latestPrice("DOGE");
        assertThat(quote.valid()).isFalse();
        assertThat(calls.get()).isZero();
    }

    @Test
    @DisplayName("server errors are retried up to maxAttempts, then the quote is invalid")
    void retriesThenInvalid() {
        OracleQuote quote = oracle(HttpStatus.INTERNAL_SERVER_ERROR, "{}", 2).latestPrice("ETH");
        assertThat(quote.isUsable()).isFalse();
        assertThat(calls.get()).isEqualTo(2);
    }
}
