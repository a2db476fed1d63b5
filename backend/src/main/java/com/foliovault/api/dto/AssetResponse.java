package com.foliovault.api.dto;

import com.foliovault.domain.Asset;

import java.math.BigInteger;

public record AssetResponse(String symbol, BigInteger amount, BigInteger value) {

    public static AssetResponse from(Asset asset) {
        return new AssetResponse(asset.getSymbol(), asset.getAmount(), asset.getValue());
    }
}
