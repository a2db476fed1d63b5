package com.foliovault.portfolio.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Portfolio registry configuration. Documented in application.yml under foliovault.portfolio.
 */
@ConfigurationProperties(prefix = "foliovault.portfolio")
@Getter
@Setter
public class PortfolioProperties {

    /**
     * Extra performance fee, percent of totalValue, charged when totalValue exceeds the bonus threshold.
     */
    private int performanceBonusPercent = 5;

    /**
     * When true, emergencyWithdrawAll removes the withdrawn assets' value from totalValue like withdraw does.
     * False keeps totalValue untouched (historical behavior).
     */
    private boolean emergencyWithdrawAdjustsValue = true;
}
