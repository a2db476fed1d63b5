package com.foliovault.pricing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.foliovault.common.RetryPolicy;
import com.foliovault.pricing.config.PricingProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Resolves USD spot price via CoinGecko /simple/price and scales it to a fixed-point integer with
 * {@code foliovault.pricing.price-decimals} decimals. Valid quotes are cached (oracleQuoteCache, short TTL).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CoinGeckoPriceOracle implements PriceOracle {

    public static final String SOURCE_ID = "coingecko";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PricingProperties pricingProperties;
    private final WebClient.Builder webClientBuilder;
    private final RateLimiter coingeckoRateLimiter;
    private final RetryPolicy oracleRetryPolicy;
    private final Clock clock;

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    @Override
    @Cacheable(cacheNames = "oracleQuoteCache", key = "#symbol", unless = "!#result.valid()")
    public OracleQuote latestPrice(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return OracleQuote.invalid(clock.instant());
        }
        String coinId = pricingProperties.getSymbolToCoinGeckoId().get(symbol.strip());
        if (coinId == null || coinId.isBlank()) {
            log.debug("No CoinGecko id for symbol {}", symbol);
            return OracleQuote.invalid(clock.instant());
        }
        String url = pricingProperties.getCoingeckoBaseUrl() + "/simple/price?ids=" + coinId + "&vs_currencies=usd";
        for (int attempt = 0; attempt < oracleRetryPolicy.getMaxAttempts(); attempt++) {
            if (attempt > 0 && !sleep(oracleRetryPolicy.delayMs(attempt - 1))) {
                break;
            }
            if (!coingeckoRateLimiter.acquirePermission()) {
                log.warn("CoinGecko rate limit exhausted for {}", coinId);
                continue;
            }
            try {
                String response = webClientBuilder.build().get()
                        .uri(url)
                        .retrieve()
                        .bodyToMono(String.class)
                        .block(Duration.ofSeconds(pricingProperties.getReadTimeoutSeconds()));
                return parseUsdPrice(response, coinId, pricingProperties.getPriceDecimals())
                        .map(price -> OracleQuote.of(price, clock.instant()))
                        .orElseGet(() -> OracleQuote.invalid(clock.instant()));
            } catch (WebClientResponseException e) {
                log.warn("CoinGecko price failed for {} (attempt {}): {}", coinId, attempt + 1, e.getMessage());
            } catch (RuntimeException e) {
                log.warn("CoinGecko price error for {} (attempt {})", coinId, attempt + 1, e);
            }
        }
        return OracleQuote.invalid(clock.instant());
    }

    static Optional<BigInteger> parseUsdPrice(String json, String coinId, int decimals) {
        if (json == null) {
            return Optional.empty();
        }
        try {
            JsonNode usd = MAPPER.readTree(json).path(coinId).path("usd");
            if (usd.isMissingNode() || !usd.isNumber()) {
                return Optional.empty();
            }
            BigDecimal scaled = usd.decimalValue().movePointRight(decimals).setScale(0, RoundingMode.DOWN);
            return Optional.of(scaled.toBigInteger());
        } catch (Exception e) {
            log.debug("Unparseable CoinGecko response for {}: {}", coinId, e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
