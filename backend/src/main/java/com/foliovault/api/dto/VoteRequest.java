package com.foliovault.api.dto;

import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

public record VoteRequest(@NotNull BigInteger votes) {
}
