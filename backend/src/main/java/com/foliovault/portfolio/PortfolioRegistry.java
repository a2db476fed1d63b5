package com.foliovault.portfolio;

import com.foliovault.domain.Amounts;
import com.foliovault.domain.Asset;
import com.foliovault.domain.LedgerErrorCode;
import com.foliovault.domain.LedgerEventType;
import com.foliovault.domain.LedgerException;
import com.foliovault.domain.LedgerRecord;
import com.foliovault.domain.Portfolio;
import com.foliovault.portfolio.config.PortfolioProperties;
import com.foliovault.pricing.OracleQuote;
import com.foliovault.pricing.PriceOracle;
import com.foliovault.pricing.PriceOracleRegistry;
import com.foliovault.token.FungibleLedger;
import com.foliovault.token.FungibleLedgerRegistry;
import com.foliovault.token.TokenTransfers;
import com.foliovault.transition.KeyedStore;
import com.foliovault.transition.TransitionExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Owns per-account portfolios and symbol -> oracle source bindings. Every mutating operation requires the
 * caller to own the portfolio ({@code NOT_OWNER} otherwise, also when no portfolio exists) and runs as one
 * ledger transition.
 */
@Service
@Slf4j
public class PortfolioRegistry {

    private final TransitionExecutor transitions;
    private final PriceOracleRegistry priceOracleRegistry;
    private final FungibleLedgerRegistry fungibleLedgerRegistry;
    private final PortfolioProperties properties;
    private final Clock clock;
    private final KeyedStore<String, Portfolio> portfolios;
    private final KeyedStore<String, String> priceFeeds;

    public PortfolioRegistry(TransitionExecutor transitions,
                             PriceOracleRegistry priceOracleRegistry,
                             FungibleLedgerRegistry fungibleLedgerRegistry,
                             PortfolioProperties properties,
                             Clock clock) {
        this.transitions = transitions;
        this.priceOracleRegistry = priceOracleRegistry;
        this.fungibleLedgerRegistry = fungibleLedgerRegistry;
        this.properties = properties;
        this.clock = clock;
        this.portfolios = transitions.newStore("portfolios", Portfolio::copy);
        this.priceFeeds = transitions.newStore("price-feeds", UnaryOperator.identity());
    }

    /**
     * @throws LedgerException ALREADY_EXISTS if the caller already has a portfolio
     */
    public Portfolio initialize(String caller) {
        Amounts.requireText(caller, "caller");
        return transitions.execute("initialize", () -> {
            if (portfolios.contains(caller)) {
                throw new LedgerException(LedgerErrorCode.ALREADY_EXISTS, "Portfolio already exists for " + caller);
            }
            Portfolio portfolio = Portfolio.open(caller, clock.instant());
            portfolios.put(caller, portfolio);
            transitions.emit(LedgerRecord.of(LedgerEventType.PORTFOLIO_INITIALIZED, caller,
                    "totalShares", portfolio.getTotalShares()));
            log.info("Portfolio initialized for {}", caller);
            return portfolio;
        });
    }

    /**
     * Appends an asset and adds its value to totalValue. Duplicate symbols are not rejected.
     */
    public Asset addAsset(String caller, String symbol, BigInteger amount, BigInteger value) {
        Amounts.requireText(symbol, "symbol");
        Amounts.requireUint(amount, "amount");
        Amounts.requireUint(value, "value");
        return transitions.execute("addAsset", () -> {
            Portfolio portfolio = ownedBy(caller);
            Asset asset = new Asset(symbol, amount, value);
            portfolio.getAssets().add(asset);
            portfolio.setTotalValue(Amounts.add(portfolio.getTotalValue(), value));
            save(portfolio);
            transitions.emit(LedgerRecord.of(LedgerEventType.ASSET_ADDED, caller,
                    "symbol", symbol, "amount", amount, "value", value));
            return asset.copy();
        });
    }

    /**
     * One-time binding of a symbol to an oracle source id.
     *
     * @throws LedgerException ALREADY_BOUND if the symbol already has a source
     */
    public void setPriceFeedSource(String caller, String symbol, String source) {
        Amounts.requireText(symbol, "symbol");
        Amounts.requireText(source, "source");
        transitions.run("setPriceFeedSource", () -> {
            if (priceFeeds.contains(symbol)) {
                throw new LedgerException(LedgerErrorCode.ALREADY_BOUND, "Price feed already bound for " + symbol);
            }
            priceFeeds.put(symbol, source);
            transitions.emit(LedgerRecord.of(LedgerEventType.PRICE_FEED_BOUND, caller, "symbol", symbol, "source", source));
        });
    }

    /**
     * Revalues an asset as {@code price * amount} from its bound oracle and moves totalValue by the difference.
     * The quote is fetched before the transition starts, so oracle I/O never holds the transition lock; the
     * binding is write-once and the asset amount is re-read inside the transition.
     *
     * @return the asset's new value
     * @throws LedgerException ASSET_NOT_FOUND, NO_ORACLE (unbound symbol or unknown source), INVALID_PRICE
     */
    public BigInteger refreshAssetValue(String caller, String symbol) {
        PriceOracle oracle = transitions.read(() -> {
            assetOf(ownedBy(caller), symbol);
            String source = priceFeeds.find(symbol)
                    .orElseThrow(() -> new LedgerException(LedgerErrorCode.NO_ORACLE, "No price feed bound for " + symbol));
            return priceOracleRegistry.find(source)
                    .orElseThrow(() -> new LedgerException(LedgerErrorCode.NO_ORACLE, "Unknown price source " + source));
        });
        OracleQuote quote = oracle.latestPrice(symbol);
        if (quote == null || !quote.isUsable()) {
            throw new LedgerException(LedgerErrorCode.INVALID_PRICE, "Invalid price for " + symbol + " from " + oracle.sourceId());
        }
        return transitions.execute("refreshAssetValue", () -> {
            Portfolio portfolio = ownedBy(caller);
            Asset asset = assetOf(portfolio, symbol);
            BigInteger oldValue = asset.getValue();
            BigInteger newValue = Amounts.mul(quote.price(), asset.getAmount());
            // totalValue may sit below the asset's value after fees or a ratio above 100; apply the delta add-first
            portfolio.setTotalValue(Amounts.sub(Amounts.add(portfolio.getTotalValue(), newValue), oldValue));
            asset.setValue(newValue);
            save(portfolio);
            transitions.emit(LedgerRecord.of(LedgerEventType.ASSET_VALUE_UPDATED, caller,
                    "symbol", symbol, "price", quote.price(), "oldValue", oldValue, "newValue", newValue));
            return newValue;
        });
    }

    /**
     * Withdraws {@code amount} of an asset to {@code to}. The value removed is
     * {@code asset.value * amount / asset.amount}, computed with the amount held before the withdrawal.
     *
     * @return the value removed from the portfolio
     * @throws LedgerException INSUFFICIENT_BALANCE, INVALID_ARGUMENT when the asset holds nothing, UNKNOWN_TOKEN,
     *                         TRANSFER_FAILED
     */
    public BigInteger withdraw(String caller, String tokenAddress, String to, String symbol, BigInteger amount) {
        Amounts.requireText(to, "to");
        Amounts.requireUint(amount, "amount");
        return transitions.execute("withdraw", () -> {
            Portfolio portfolio = ownedBy(caller);
            Asset asset = assetOf(portfolio, symbol);
            if (amount.compareTo(asset.getAmount()) > 0) {
                throw new LedgerException(LedgerErrorCode.INSUFFICIENT_BALANCE,
                        "Withdrawal of " + amount + " " + symbol + " exceeds holding " + asset.getAmount());
            }
            if (asset.getAmount().signum() == 0) {
                throw new LedgerException(LedgerErrorCode.INVALID_ARGUMENT, "Asset " + symbol + " holds nothing");
            }
            BigInteger removedValue = debit(portfolio, asset, amount, true);
            save(portfolio);
            TokenTransfers.pay(fungibleLedgerRegistry.resolve(tokenAddress), to, amount);
            transitions.emit(LedgerRecord.of(LedgerEventType.WITHDRAWAL, caller,
                    "symbol", symbol, "token", tokenAddress, "to", to, "amount", amount, "value", removedValue));
            return removedValue;
        });
    }

    /**
     * Withdraws every listed position in full to the caller. Position {@code i} of the asset sequence is paid
     * with {@code tokenAddresses.get(i)}; matching the two is the caller's responsibility.
     *
     * @return amounts withdrawn, by position
     * @throws LedgerException ASSET_NOT_FOUND past the end of the asset sequence, NOTHING_TO_WITHDRAW for an empty
     *                         position
     */
    public List<BigInteger> emergencyWithdrawAll(String caller, List<String> tokenAddresses) {
        if (tokenAddresses == null) {
            throw new LedgerException(LedgerErrorCode.INVALID_ARGUMENT, "tokenAddresses is required");
        }
        return transitions.execute("emergencyWithdrawAll", () -> {
            Portfolio portfolio = ownedBy(caller);
            List<BigInteger> withdrawn = new ArrayList<>(tokenAddresses.size());
            for (int i = 0; i < tokenAddresses.size(); i++) {
                if (i >= portfolio.getAssets().size()) {
                    throw new LedgerException(LedgerErrorCode.ASSET_NOT_FOUND, "No asset at position " + i);
                }
                Asset asset = portfolio.getAssets().get(i);
                BigInteger amount = asset.getAmount();
                if (amount.signum() == 0) {
                    throw new LedgerException(LedgerErrorCode.NOTHING_TO_WITHDRAW,
                            "Nothing to withdraw for " + asset.getSymbol() + " at position " + i);
                }
                FungibleLedger ledger = fungibleLedgerRegistry.resolve(tokenAddresses.get(i));
                BigInteger removedValue = debit(portfolio, asset, amount, properties.isEmergencyWithdrawAdjustsValue());
                TokenTransfers.pay(ledger, caller, amount);
                withdrawn.add(amount);
                transitions.emit(LedgerRecord.of(LedgerEventType.EMERGENCY_WITHDRAWAL, caller,
                        "position", i, "symbol", asset.getSymbol(), "token", ledger.tokenAddress(),
                        "amount", amount, "value", removedValue));
            }
            save(portfolio);
            log.info("Emergency withdrawal of {} position(s) for {}", withdrawn.size(), caller);
            return withdrawn;
        });
    }

    /**
     * Sets each listed asset's value to {@code totalValue * ratio / 100}, using totalValue as it was on entry.
     * Ratios are not required to sum to 100 and totalValue itself is left unchanged.
     */
    public void rebalance(String caller, List<String> symbols, List<BigInteger> targetRatios) {
        if (symbols == null || targetRatios == null || symbols.size() != targetRatios.size()) {
            throw new LedgerException(LedgerErrorCode.INVALID_ARGUMENT, "symbols and targetRatios must have equal length");
        }
        targetRatios.forEach(r -> Amounts.requireUint(r, "targetRatio"));
        transitions.run("rebalance", () -> {
            Portfolio portfolio = ownedBy(caller);
            BigInteger totalAtEntry = portfolio.getTotalValue();
            for (int i = 0; i < symbols.size(); i++) {
                Asset asset = assetOf(portfolio, symbols.get(i));
                asset.setValue(Amounts.percentOf(totalAtEntry, targetRatios.get(i)));
            }
            save(portfolio);
            transitions.emit(LedgerRecord.of(LedgerEventType.REBALANCED, caller,
                    "symbols", symbols, "targetRatios", targetRatios, "totalValue", totalAtEntry));
        });
    }

    /**
     * @return whether totalValue lies inside [minValueThreshold, maxValueThreshold]
     */
    public boolean checkRisk(String caller) {
        return transitions.read(() -> ownedBy(caller).isWithinRiskBand());
    }

    /**
     * Deducts management and performance fees from the recorded totalValue. A flat bonus
     * ({@code performanceBonusPercent}) is added to the performance fee when totalValue exceeds
     * {@code bonusThreshold}. The fees are not paid to any account.
     *
     * @throws LedgerException VALUE_UNDERFLOW when the fees exceed totalValue
     */
    public FeeCharge applyDynamicFees(String caller, BigInteger bonusThreshold) {
        Amounts.requireUint(bonusThreshold, "bonusThreshold");
        return transitions.execute("applyDynamicFees", () -> {
            Portfolio portfolio = ownedBy(caller);
            BigInteger total = portfolio.getTotalValue();
            BigInteger managementFee = Amounts.percentOf(total, portfolio.getManagementFee());
            BigInteger performanceFee = Amounts.percentOf(total, portfolio.getPerformanceFee());
            boolean bonus = total.compareTo(bonusThreshold) > 0;
            if (bonus) {
                performanceFee = Amounts.add(performanceFee,
                        Amounts.percentOf(total, BigInteger.valueOf(properties.getPerformanceBonusPercent())));
            }
            BigInteger remaining = Amounts.sub(total, Amounts.add(managementFee, performanceFee));
            portfolio.setTotalValue(remaining);
            save(portfolio);
            transitions.emit(LedgerRecord.of(LedgerEventType.FEES_APPLIED, caller,
                    "managementFee", managementFee, "performanceFee", performanceFee, "bonusApplied", bonus));
            return new FeeCharge(managementFee, performanceFee, bonus, remaining);
        });
    }

    /**
     * @throws LedgerException INVALID_ARGUMENT for a rate above 100
     */
    public void setFeeRates(String caller, BigInteger managementFee, BigInteger performanceFee) {
        requirePercent(managementFee, "managementFee");
        requirePercent(performanceFee, "performanceFee");
        transitions.run("setFeeRates", () -> {
            Portfolio portfolio = ownedBy(caller);
            portfolio.setManagementFee(managementFee);
            portfolio.setPerformanceFee(performanceFee);
            save(portfolio);
            transitions.emit(LedgerRecord.of(LedgerEventType.PORTFOLIO_CONFIGURED, caller,
                    "managementFee", managementFee, "performanceFee", performanceFee));
        });
    }

    /**
     * @throws LedgerException INVALID_ARGUMENT when min exceeds max
     */
    public void setRiskThresholds(String caller, BigInteger minValue, BigInteger maxValue) {
        Amounts.requireUint(minValue, "minValueThreshold");
        Amounts.requireUint(maxValue, "maxValueThreshold");
        if (minValue.compareTo(maxValue) > 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_ARGUMENT, "minValueThreshold exceeds maxValueThreshold");
        }
        transitions.run("setRiskThresholds", () -> {
            Portfolio portfolio = ownedBy(caller);
            portfolio.setMinValueThreshold(minValue);
            portfolio.setMaxValueThreshold(maxValue);
            save(portfolio);
            transitions.emit(LedgerRecord.of(LedgerEventType.PORTFOLIO_CONFIGURED, caller,
                    "minValueThreshold", minValue, "maxValueThreshold", maxValue));
        });
    }

    /**
     * Appends the current totalValue to the portfolio's historical values.
     */
    public BigInteger recordValueSnapshot(String caller) {
        return transitions.execute("recordValueSnapshot", () -> {
            Portfolio portfolio = ownedBy(caller);
            portfolio.getHistoricalValues().add(portfolio.getTotalValue());
            save(portfolio);
            transitions.emit(LedgerRecord.of(LedgerEventType.VALUE_SNAPSHOT, caller,
                    "totalValue", portfolio.getTotalValue(), "index", portfolio.getHistoricalValues().size() - 1));
            return portfolio.getTotalValue();
        });
    }

    public Optional<Portfolio> findPortfolio(String owner) {
        return transitions.read(() -> portfolios.find(owner));
    }

    public boolean exists(String owner) {
        return transitions.read(() -> owner != null && portfolios.contains(owner));
    }

    public Optional<String> findPriceFeedSource(String symbol) {
        return transitions.read(() -> priceFeeds.find(symbol));
    }

    /**
     * Reduces the asset's amount and, when {@code adjustValue}, its value and totalValue by the proportional share
     * {@code value * amount / priorAmount}. Returns the value removed (zero when not adjusted).
     */
    private static BigInteger debit(Portfolio portfolio, Asset asset, BigInteger amount, boolean adjustValue) {
        BigInteger priorAmount = asset.getAmount();
        asset.setAmount(Amounts.sub(priorAmount, amount));
        if (!adjustValue) {
            return BigInteger.ZERO;
        }
        BigInteger removed = Amounts.mulDiv(asset.getValue(), amount, priorAmount);
        asset.setValue(Amounts.sub(asset.getValue(), removed));
        portfolio.setTotalValue(Amounts.sub(portfolio.getTotalValue(), removed));
        return removed;
    }

    private Portfolio ownedBy(String caller) {
        Portfolio portfolio = caller == null ? null : portfolios.find(caller).orElse(null);
        if (portfolio == null || !portfolio.getOwner().equals(caller)) {
            throw new LedgerException(LedgerErrorCode.NOT_OWNER, "Caller " + caller + " does not own a portfolio");
        }
        return portfolio;
    }

    private static Asset assetOf(Portfolio portfolio, String symbol) {
        return portfolio.findAsset(symbol)
                .orElseThrow(() -> new LedgerException(LedgerErrorCode.ASSET_NOT_FOUND, "Asset not found: " + symbol));
    }

    private void save(Portfolio portfolio) {
        portfolio.setLastUpdateTimestamp(clock.instant());
        portfolios.put(portfolio.getOwner(), portfolio);
    }

    private static void requirePercent(BigInteger value, String name) {
        Amounts.requireUint(value, name);
        if (value.compareTo(BigInteger.valueOf(100)) > 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_ARGUMENT, name + " must be at most 100");
        }
    }
}
