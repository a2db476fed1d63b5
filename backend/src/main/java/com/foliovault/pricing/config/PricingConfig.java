package com.foliovault.pricing.config;

import com.foliovault.common.RetryPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Pricing module configuration: properties and shared beans for the CoinGecko client.
 */
@Configuration
@EnableConfigurationProperties(PricingProperties.class)
public class PricingConfig {

    @Bean
    public RateLimiter coingeckoRateLimiter(PricingProperties pricingProperties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(pricingProperties.getCoingeckoRequestsPerMinute())
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .timeoutDuration(Duration.ofSeconds(pricingProperties.getRateLimitWaitSeconds()))
                .build();
        return RateLimiter.of("coingecko", config);
    }

    @Bean
    public RetryPolicy oracleRetryPolicy(PricingProperties pricingProperties) {
        return new RetryPolicy(pricingProperties.getRetryBaseDelayMs(), 0.2, pricingProperties.getMaxAttempts());
    }
}
