package com.foliovault.api.dto;

import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

/**
 * Percent rates, 0..100 each.
 */
public record FeeRatesRequest(
        @NotNull BigInteger managementFee,
        @NotNull BigInteger performanceFee
) {
}
