package com.foliovault.api.dto;

public record ReferralResponse(String account, String referrer) {
}
