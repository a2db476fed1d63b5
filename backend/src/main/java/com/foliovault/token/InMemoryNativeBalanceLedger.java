package com.foliovault.token;

import com.foliovault.common.UintMath;
import com.foliovault.transition.KeyedStore;
import com.foliovault.transition.TransitionExecutor;

import java.math.BigInteger;
import java.util.function.UnaryOperator;

/**
 * Host native balances in journaled storage; see {@link InMemoryFungibleLedger}.
 */
public class InMemoryNativeBalanceLedger implements NativeBalanceLedger {

    private final TransitionExecutor transitions;
    private final KeyedStore<String, BigInteger> balances;

    public InMemoryNativeBalanceLedger(TransitionExecutor transitions) {
        this.transitions = transitions;
        this.balances = transitions.newStore("native-balances", UnaryOperator.identity());
    }

    @Override
    public BigInteger balanceOf(String account) {
        return transitions.read(() -> balances.find(account).orElse(BigInteger.ZERO));
    }

    @Override
    public boolean transfer(String from, String to, BigInteger amount) {
        return transitions.execute("native-transfer", () -> {
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
        });
    }

    public void credit(String account, BigInteger amount) {
        if (!UintMath.isPositive(amount)) {
            throw new IllegalArgumentException("Credit amount must be positive: " + amount);
        }
        transitions.run("native-credit", () ->
                balances.put(account, UintMath.add(balances.find(account).orElse(BigInteger.ZERO), amount)));
    }
}
