package com.foliovault.api.dto;

import com.foliovault.api.validation.AccountAddress;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

public record WithdrawRequest(
        @AccountAddress String tokenAddress,
        @AccountAddress String to,
        @NotBlank String symbol,
        @NotNull BigInteger amount
) {
}
