package com.foliovault.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

/**
 * POST /api/v1/portfolios/me/assets request body.
 */
public record AddAssetRequest(
        @NotBlank String symbol,
        @NotNull BigInteger amount,
        @NotNull BigInteger value
) {
}
