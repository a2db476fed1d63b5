package com.foliovault.domain;

import com.foliovault.common.UintMath;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Per-owner portfolio. Created once per account and never deleted. {@code totalValue} equals the sum of asset
 * values after every committed transition (fee application and rebalancing are the documented exceptions).
 */
@NoArgsConstructor
@Getter
@Setter
public class Portfolio {

    public static final BigInteger INITIAL_SHARES = BigInteger.valueOf(1_000_000);

    private String owner;
    private BigInteger totalValue = BigInteger.ZERO;
    private BigInteger totalShares = INITIAL_SHARES;
    private List<Asset> assets = new ArrayList<>();
    private List<BigInteger> historicalValues = new ArrayList<>();
    private Instant lastUpdateTimestamp;
    private BigInteger minValueThreshold = BigInteger.ZERO;
    private BigInteger maxValueThreshold = UintMath.MAX;
    /** Percent of totalValue, 0..100. */
    private BigInteger managementFee = BigInteger.ZERO;
    /** Percent of totalValue, 0..100. */
    private BigInteger performanceFee = BigInteger.ZERO;
    private BigInteger riskScore = BigInteger.ZERO;

    public static Portfolio open(String owner, Instant now) {
        Portfolio p = new Portfolio();
        p.setOwner(owner);
        p.setLastUpdateTimestamp(now);
        return p;
    }

    /**
     * First asset with the given symbol. Duplicates are allowed; later entries are shadowed.
     */
    public Optional<Asset> findAsset(String symbol) {
        return assets.stream()
                .filter(a -> a.getSymbol().equals(symbol))
                .findFirst();
    }

    public BigInteger sumOfAssetValues() {
        return assets.stream()
                .map(Asset::getValue)
                .reduce(BigInteger.ZERO, BigInteger::add);
    }

    public boolean isWithinRiskBand() {
        return minValueThreshold.compareTo(totalValue) <= 0 && totalValue.compareTo(maxValueThreshold) <= 0;
    }

    public Portfolio copy() {
        Portfolio p = new Portfolio();
        p.owner = owner;
        p.totalValue = totalValue;
        p.totalShares = totalShares;
        p.assets = new ArrayList<>(assets.size());
        assets.forEach(a -> p.assets.add(a.copy()));
        p.historicalValues = new ArrayList<>(historicalValues);
        p.lastUpdateTimestamp = lastUpdateTimestamp;
        p.minValueThreshold = minValueThreshold;
        p.maxValueThreshold = maxValueThreshold;
        p.managementFee = managementFee;
        p.performanceFee = performanceFee;
        p.riskScore = riskScore;
        return p;
    }
}
