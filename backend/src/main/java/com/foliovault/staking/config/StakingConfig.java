package com.foliovault.staking.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(StakingProperties.class)
public class StakingConfig {
}
