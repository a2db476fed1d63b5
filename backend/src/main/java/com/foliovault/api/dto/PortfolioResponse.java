package com.foliovault.api.dto;

import com.foliovault.domain.Portfolio;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

/**
 * GET /api/v1/portfolios/{owner} response body.
 */
public record PortfolioResponse(
        String owner,
        BigInteger totalValue,
        BigInteger totalShares,
        List<AssetResponse> assets,
        List<BigInteger> historicalValues,
        Instant lastUpdateTimestamp,
        BigInteger minValueThreshold,
        BigInteger maxValueThreshold,
        BigInteger managementFee,
        BigInteger performanceFee,
        BigInteger riskScore,
        boolean withinRiskBand
) {

    public static PortfolioResponse from(Portfolio p) {
        return new PortfolioResponse(
                p.getOwner(),
                p.getTotalValue(),
                p.getTotalShares(),
                p.getAssets().stream().map(AssetResponse::from).toList(),
                List.copyOf(p.getHistoricalValues()),
                p.getLastUpdateTimestamp(),
                p.getMinValueThreshold(),
                p.getMaxValueThreshold(),
                p.getManagementFee(),
                p.getPerformanceFee(),
                p.getRiskScore(),
                p.isWithinRiskBand());
    }
}
