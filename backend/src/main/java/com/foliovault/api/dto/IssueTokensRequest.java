package com.foliovault.api.dto;

import com.foliovault.api.validation.AccountAddress;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

public record IssueTokensRequest(
        @AccountAddress String to,
        @NotNull BigInteger amount
) {
}
