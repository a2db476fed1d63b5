package com.foliovault.staking;

import com.foliovault.domain.Amounts;
import com.foliovault.domain.LedgerErrorCode;
import com.foliovault.domain.LedgerEventType;
import com.foliovault.domain.LedgerException;
import com.foliovault.domain.LedgerRecord;
import com.foliovault.domain.StakeInfo;
import com.foliovault.staking.config.StakingProperties;
import com.foliovault.token.FungibleLedger;
import com.foliovault.token.FungibleLedgerRegistry;
import com.foliovault.token.TokenTransfers;
import com.foliovault.transition.JournaledValue;
import com.foliovault.transition.KeyedStore;
import com.foliovault.transition.TransitionExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Governance-token staking held in custody. totalStaked always equals the sum of all stakes.
 * <p>
 * Rewards are {@code amount * completedPeriods * rewardPercent / 100}, counted from {@code lastStakeTime}.
 * Claiming does not move {@code lastStakeTime}, so repeated claims pay for the same elapsed periods again;
 * only a new stake resets the clock.
 */
@Service
@Slf4j
public class StakingLedger {

    private final TransitionExecutor transitions;
    private final FungibleLedgerRegistry fungibleLedgerRegistry;
    private final StakingProperties properties;
    private final Clock clock;
    private final KeyedStore<String, StakeInfo> stakes;
    private final JournaledValue<BigInteger> totalStaked;

    public StakingLedger(TransitionExecutor transitions,
                         FungibleLedgerRegistry fungibleLedgerRegistry,
                         StakingProperties properties,
                         Clock clock) {
        if (properties.getRewardPeriod() == null || properties.getRewardPeriod().getSeconds() <= 0) {
            throw new IllegalArgumentException("foliovault.staking.reward-period must be at least one second");
        }
        this.transitions = transitions;
        this.fungibleLedgerRegistry = fungibleLedgerRegistry;
        this.properties = properties;
        this.clock = clock;
        this.stakes = transitions.newStore("stakes", StakeInfo::copy);
        this.totalStaked = transitions.newValue("total-staked", BigInteger.ZERO);
    }

    /**
     * Pulls {@code amount} governance tokens from the caller into custody (requires an allowance) and restarts the
     * caller's reward clock.
     */
    public StakeInfo stake(String caller, BigInteger amount) {
        Amounts.requireText(caller, "caller");
        Amounts.requirePositive(amount, "amount");
        return transitions.execute("stake", () -> {
            FungibleLedger token = fungibleLedgerRegistry.governanceToken();
            TokenTransfers.pull(token, caller, fungibleLedgerRegistry.custodyAddress(), amount);
            StakeInfo info = stakes.find(caller).orElseGet(StakeInfo::new);
            info.setAmount(Amounts.add(info.getAmount(), amount));
            info.setLastStakeTime(clock.instant());
            stakes.put(caller, info);
            totalStaked.set(Amounts.add(totalStaked.get(), amount));
            transitions.emit(LedgerRecord.of(LedgerEventType.STAKED, caller, "amount", amount, "stake", info.getAmount()));
            return info;
        });
    }

    /**
     * @throws LedgerException INSUFFICIENT_STAKE when the caller's stake is smaller than {@code amount}
     */
    public StakeInfo unstake(String caller, BigInteger amount) {
        Amounts.requirePositive(amount, "amount");
        return transitions.execute("unstake", () -> {
            StakeInfo info = stakeOf(caller);
            if (info.getAmount().compareTo(amount) < 0) {
                throw new LedgerException(LedgerErrorCode.INSUFFICIENT_STAKE,
                        "Stake of " + caller + " is " + info.getAmount() + ", cannot unstake " + amount);
            }
            info.setAmount(info.getAmount().subtract(amount));
            stakes.put(caller, info);
            totalStaked.set(Amounts.sub(totalStaked.get(), amount));
            TokenTransfers.pay(fungibleLedgerRegistry.governanceToken(), caller, amount);
            transitions.emit(LedgerRecord.of(LedgerEventType.UNSTAKED, caller, "amount", amount, "stake", info.getAmount()));
            return info;
        });
    }

    /**
     * Pays the reward accrued since {@code lastStakeTime} from custody.
     *
     * @return reward paid (zero before the first full period)
     * @throws LedgerException INSUFFICIENT_STAKE when the caller has nothing staked
     */
    public BigInteger claimRewards(String caller) {
        return transitions.execute("claimRewards", () -> {
            StakeInfo info = stakeOf(caller);
            if (info.getAmount().signum() == 0) {
                throw new LedgerException(LedgerErrorCode.INSUFFICIENT_STAKE, "No stake for " + caller);
            }
            long periods = completedPeriods(info.getLastStakeTime(), clock.instant());
            BigInteger reward = rewardFor(info.getAmount(), periods);
            if (reward.signum() > 0) {
                TokenTransfers.pay(fungibleLedgerRegistry.governanceToken(), caller, reward);
            }
            transitions.emit(LedgerRecord.of(LedgerEventType.STAKING_REWARD_CLAIMED, caller,
                    "reward", reward, "periods", periods, "stake", info.getAmount()));
            log.info("Staking reward of {} paid to {} for {} period(s)", reward, caller, periods);
            return reward;
        });
    }

    /**
     * Reduces a stake as a penalty. No HTTP entry point reaches this; it exists for an enforcement trigger that has
     * not been defined.
     *
     * @throws LedgerException INSUFFICIENT_STAKE when {@code amount} exceeds the stake
     */
    StakeInfo slash(String account, BigInteger amount) {
        Amounts.requirePositive(amount, "amount");
        return transitions.execute("slash", () -> {
            StakeInfo info = stakeOf(account);
            if (info.getAmount().compareTo(amount) < 0) {
                throw new LedgerException(LedgerErrorCode.INSUFFICIENT_STAKE,
                        "Cannot slash " + amount + " from stake " + info.getAmount() + " of " + account);
            }
            info.setAmount(info.getAmount().subtract(amount));
            stakes.put(account, info);
            totalStaked.set(Amounts.sub(totalStaked.get(), amount));
            transitions.emit(LedgerRecord.of(LedgerEventType.SLASHED, account, "amount", amount, "stake", info.getAmount()));
            log.warn("Slashed {} from stake of {}", amount, account);
            return info;
        });
    }

    /**
     * Reward the caller would receive if they claimed now.
     */
    public BigInteger pendingReward(String account) {
        return transitions.read(() -> stakes.find(account)
                .map(info -> rewardFor(info.getAmount(), completedPeriods(info.getLastStakeTime(), clock.instant())))
                .orElse(BigInteger.ZERO));
    }

    public Optional<StakeInfo> findStake(String account) {
        return transitions.read(() -> stakes.find(account));
    }

    public BigInteger totalStaked() {
        return transitions.read(totalStaked::get);
    }

    private StakeInfo stakeOf(String account) {
        return stakes.find(account).orElseGet(StakeInfo::new);
    }

    private long completedPeriods(Instant since, Instant now) {
        if (since == null || !now.isAfter(since)) {
            return 0;
        }
        return Duration.between(since, now).getSeconds() / properties.getRewardPeriod().getSeconds();
    }

    private BigInteger rewardFor(BigInteger amount, long periods) {
        return Amounts.percentOf(Amounts.mul(amount, BigInteger.valueOf(periods)),
                BigInteger.valueOf(properties.getRewardPercent()));
    }
}
