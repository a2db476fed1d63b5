package com.foliovault.api.dto;

import com.foliovault.api.validation.AccountAddress;

public record ReferralRequest(@AccountAddress String newUser) {
}
