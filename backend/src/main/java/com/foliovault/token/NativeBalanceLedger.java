package com.foliovault.token;

import java.math.BigInteger;

/**
 * Native-currency balances of the execution host. Used by the flash-loan engine.
 */
public interface NativeBalanceLedger {

    BigInteger balanceOf(String account);

    boolean transfer(String from, String to, BigInteger amount);
}
