package com.foliovault.api.dto;

import com.foliovault.api.validation.AccountAddress;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Token address per asset, in asset order.
 */
public record EmergencyWithdrawRequest(@NotNull List<@AccountAddress String> tokenAddresses) {
}
