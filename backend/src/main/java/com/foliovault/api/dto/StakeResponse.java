package com.foliovault.api.dto;

import java.math.BigInteger;
import java.time.Instant;

public record StakeResponse(String account, BigInteger amount, Instant lastStakeTime, BigInteger pendingReward) {
}
