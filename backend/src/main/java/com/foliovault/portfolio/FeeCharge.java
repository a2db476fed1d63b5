package com.foliovault.portfolio;

import java.math.BigInteger;

/**
 * Fees deducted from a portfolio's recorded value by applyDynamicFees. Nothing is transferred.
 */
public record FeeCharge(BigInteger managementFee, BigInteger performanceFee, boolean bonusApplied, BigInteger remainingValue) {

    public BigInteger total() {
        return managementFee.add(performanceFee);
    }
}
