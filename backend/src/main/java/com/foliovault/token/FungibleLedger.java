package com.foliovault.token;

import java.math.BigInteger;

/**
 * Handle on an external fungible-token ledger, bound to the vault's custody account: {@code transfer} moves
 * tokens out of custody and {@code transferFrom} spends an allowance granted to custody. A {@code false} return
 * is a failed transfer; the enclosing ledger transition must abort.
 */
public interface FungibleLedger {

    String tokenAddress();

    boolean transfer(String to, BigInteger amount);

    boolean transferFrom(String from, String to, BigInteger amount);

    BigInteger balanceOf(String account);

    BigInteger totalSupply();
}
