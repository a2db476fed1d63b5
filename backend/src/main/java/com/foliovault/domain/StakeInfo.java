package com.foliovault.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Custody-held stake of one account. Zeroed, never removed, on full withdrawal.
 */
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
public class StakeInfo {

    private BigInteger amount = BigInteger.ZERO;
    private Instant lastStakeTime;

    public StakeInfo copy() {
        return new StakeInfo(amount, lastStakeTime);
    }
}
