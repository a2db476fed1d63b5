package com.foliovault.api.dto;

import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

public record RiskThresholdsRequest(
        @NotNull BigInteger minValue,
        @NotNull BigInteger maxValue
) {
}
