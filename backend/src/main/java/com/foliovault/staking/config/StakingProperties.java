package com.foliovault.staking.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Staking configuration. Documented in application.yml under foliovault.staking.
 */
@ConfigurationProperties(prefix = "foliovault.staking")
@Getter
@Setter
public class StakingProperties {

    /**
     * Length of one reward period. Partial periods earn nothing.
     */
    private Duration rewardPeriod = Duration.ofDays(30);

    /**
     * Reward per completed period, percent of the staked amount.
     */
    private int rewardPercent = 1;
}
