package com.foliovault.flashloan.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;

/**
 * Flash-loan configuration. Documented in application.yml under foliovault.flash-loan.
 */
@ConfigurationProperties(prefix = "foliovault.flash-loan")
@Getter
@Setter
public class FlashLoanProperties {

    /**
     * Fee rate in 18-decimal fixed point (10^18 = 100%). Default 5%.
     */
    private BigInteger feeRate = new BigInteger("50000000000000000");
}
