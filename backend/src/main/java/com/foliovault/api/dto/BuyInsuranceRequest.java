package com.foliovault.api.dto;

import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

public record BuyInsuranceRequest(
        @NotNull BigInteger coverageAmount,
        @NotNull BigInteger premium
) {
}
