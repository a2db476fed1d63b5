package com.foliovault.api.dto;

import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;
import java.util.List;

public record RebalanceRequest(
        @NotNull List<String> symbols,
        @NotNull List<BigInteger> targetRatios
) {
}
