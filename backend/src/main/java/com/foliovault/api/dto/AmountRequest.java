package com.foliovault.api.dto;

import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

/**
 * Single-amount body shared by stake, unstake, flash loan and custody approval.
 */
public record AmountRequest(@NotNull BigInteger amount) {
}
