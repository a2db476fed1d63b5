package com.foliovault.insurance;

import com.foliovault.domain.Amounts;
import com.foliovault.domain.InsurancePolicy;
import com.foliovault.domain.LedgerErrorCode;
import com.foliovault.domain.LedgerEventType;
import com.foliovault.domain.LedgerException;
import com.foliovault.domain.LedgerRecord;
import com.foliovault.portfolio.PortfolioRegistry;
import com.foliovault.token.FungibleLedgerRegistry;
import com.foliovault.token.TokenTransfers;
import com.foliovault.transition.KeyedStore;
import com.foliovault.transition.TransitionExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Optional;

/**
 * One coverage policy per portfolio owner. The premium must be exactly 1% of coverage (integer division) and is
 * recorded on the policy only; no tokens are collected for it. Claims pay the full coverage in governance tokens.
 */
@Service
@Slf4j
public class InsuranceModule {

    static final BigInteger PREMIUM_DIVISOR = BigInteger.valueOf(100);

    private final TransitionExecutor transitions;
    private final PortfolioRegistry portfolioRegistry;
    private final FungibleLedgerRegistry fungibleLedgerRegistry;
    private final Clock clock;
    private final KeyedStore<String, InsurancePolicy> policies;

    public InsuranceModule(TransitionExecutor transitions,
                           PortfolioRegistry portfolioRegistry,
                           FungibleLedgerRegistry fungibleLedgerRegistry,
                           Clock clock) {
        this.transitions = transitions;
        this.portfolioRegistry = portfolioRegistry;
        this.fungibleLedgerRegistry = fungibleLedgerRegistry;
        this.clock = clock;
        this.policies = transitions.newStore("insurance-policies", InsurancePolicy::copy);
    }

    /**
     * Replaces any existing policy of the caller.
     *
     * @throws LedgerException NOT_OWNER without a portfolio, INVALID_ARGUMENT when the premium is not coverage / 100
     */
    public InsurancePolicy buyInsurance(String caller, BigInteger coverageAmount, BigInteger premium) {
        Amounts.requirePositive(coverageAmount, "coverageAmount");
        Amounts.requireUint(premium, "premium");
        return transitions.execute("buyInsurance", () -> {
            if (!portfolioRegistry.exists(caller)) {
                throw new LedgerException(LedgerErrorCode.NOT_OWNER, "No portfolio owned by " + caller);
            }
            BigInteger required = requiredPremium(coverageAmount);
            if (!premium.equals(required)) {
                throw new LedgerException(LedgerErrorCode.INVALID_ARGUMENT,
                        "Premium for coverage " + coverageAmount + " must be " + required + ", got " + premium);
            }
            InsurancePolicy policy = new InsurancePolicy(true, coverageAmount, premium, clock.instant());
            policies.put(caller, policy);
            transitions.emit(LedgerRecord.of(LedgerEventType.INSURANCE_PURCHASED, caller,
                    "coverageAmount", coverageAmount, "premium", premium));
            log.info("Insurance bought by {} with coverage {}", caller, coverageAmount);
            return policy;
        });
    }

    /**
     * Deactivates the caller's policy and pays its coverage.
     *
     * @return coverage paid
     * @throws LedgerException POLICY_INACTIVE when the caller has no active policy
     */
    public BigInteger claimInsurance(String caller) {
        return transitions.execute("claimInsurance", () -> {
            InsurancePolicy policy = policies.find(caller)
                    .filter(InsurancePolicy::isActive)
                    .orElseThrow(() -> new LedgerException(LedgerErrorCode.POLICY_INACTIVE, "No active policy for " + caller));
            policy.setActive(false);
            policies.put(caller, policy);
            TokenTransfers.pay(fungibleLedgerRegistry.governanceToken(), caller, policy.getCoverageAmount());
            transitions.emit(LedgerRecord.of(LedgerEventType.INSURANCE_CLAIMED, caller, "coverageAmount", policy.getCoverageAmount()));
            log.info("Insurance claim of {} paid to {}", policy.getCoverageAmount(), caller);
            return policy.getCoverageAmount();
        });
    }

    public Optional<InsurancePolicy> findPolicy(String account) {
        return transitions.read(() -> policies.find(account));
    }

    public static BigInteger requiredPremium(BigInteger coverageAmount) {
        return coverageAmount.divide(PREMIUM_DIVISOR);
    }
}
