package com.foliovault.api.dto;

import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

public record DynamicFeesRequest(@NotNull BigInteger bonusThreshold) {
}
