package com.foliovault.token;

import com.foliovault.common.UintMath;
import com.foliovault.transition.JournaledValue;
import com.foliovault.transition.KeyedStore;
import com.foliovault.transition.TransitionExecutor;

import java.math.BigInteger;
import java.util.function.UnaryOperator;

/**
 * Host-side token ledger kept in the same journaled storage as the vault, so a rolled-back transition also
 * rolls back its transfers. Stands in for an external token contract when the service runs standalone.
 */
public class InMemoryFungibleLedger implements FungibleLedger {

    private final String tokenAddress;
    private final String custodyAddress;
    private final TransitionExecutor transitions;
    private final KeyedStore<String, BigInteger> balances;
    private final KeyedStore<Allowance, BigInteger> allowances;
    private final JournaledValue<BigInteger> supply;

    public InMemoryFungibleLedger(String tokenAddress, String custodyAddress, TransitionExecutor transitions) {
        this.tokenAddress = tokenAddress;
        this.custodyAddress = custodyAddress;
        this.transitions = transitions;
        this.balances = transitions.newStore("balances:" + tokenAddress, UnaryOperator.identity());
        this.allowances = transitions.newStore("allowances:" + tokenAddress, UnaryOperator.identity());
        this.supply = transitions.newValue("supply:" + tokenAddress, BigInteger.ZERO);
    }

    @Override
    public String tokenAddress() {
        return tokenAddress;
    }

    @Override
    public boolean transfer(String to, BigInteger amount) {
        return transitions.execute("token-transfer", () -> move(custodyAddress, to, amount));
    }

    @Override
    public boolean transferFrom(String from, String to, BigInteger amount) {
        return transitions.execute("token-transfer-from", () -> {
            Allowance key = new Allowance(from, custodyAddress);
            BigInteger allowed = allowances.find(key).orElse(BigInteger.ZERO);
            if (allowed.compareTo(amount) < 0) {
                return false;
            }
            if (!move(from, to, amount)) {
                return false;
            }
            allowances.put(key, allowed.subtract(amount));
            return true;
        });
    }

    @Override
    public BigInteger balanceOf(String account) {
        return transitions.read(() -> balances.find(account).orElse(BigInteger.ZERO));
    }

    @Override
    public BigInteger totalSupply() {
        return transitions.read(supply::get);
    }

    public void approve(String owner, String spender, BigInteger amount) {
        if (!UintMath.isUint(amount)) {
            throw new IllegalArgumentException("Allowance must be a uint256: " + amount);
        }
        transitions.run("token-approve", () -> allowances.put(new Allowance(owner, spender), amount));
    }

    public BigInteger allowance(String owner, String spender) {
        return transitions.read(() -> allowances.find(new Allowance(owner, spender)).orElse(BigInteger.ZERO));
    }

    public void mint(String account, BigInteger amount) {
        if (!UintMath.isPositive(amount)) {
            throw new IllegalArgumentException("Mint amount must be positive: " + amount);
        }
        transitions.run("token-mint", () -> {
            balances.put(account, UintMath.add(balances.find(account).orElse(BigInteger.ZERO), amount));
            supply.set(UintMath.add(supply.get(), amount));
        });
    }

    private boolean move(String from, String to, BigInteger amount) {
        if (amount == null || amount.signum() < 0 || to == null) {
            return false;
        }
        BigInteger fromBalance = balances.find(from).orElse(BigInteger.ZERO);
        if (fromBalance.compareTo(amount) < 0) {
            return false;
        }
        balances.put(from, fromBalance.subtract(amount));
        balances.put(to, balances.find(to).orElse(BigInteger.ZERO).add(amount));
        return true;
    }

    private record Allowance(String owner, String spender) {
    }
}
