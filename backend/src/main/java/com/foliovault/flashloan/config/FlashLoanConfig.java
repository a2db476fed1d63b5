package com.foliovault.flashloan.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(FlashLoanProperties.class)
public class FlashLoanConfig {
}
