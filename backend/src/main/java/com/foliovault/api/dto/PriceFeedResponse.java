package com.foliovault.api.dto;

public record PriceFeedResponse(String symbol, String source) {
}
