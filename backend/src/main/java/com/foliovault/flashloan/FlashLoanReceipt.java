package com.foliovault.flashloan;

import java.math.BigInteger;

/**
 * Outcome of a committed flash loan. Balances are the borrower's native balance before disbursement and after
 * the receiver callback.
 */
public record FlashLoanReceipt(
        String borrower,
        BigInteger amount,
        BigInteger fee,
        FlashLoanPhase phase,
        BigInteger balanceBeforeLoan,
        BigInteger balanceAfterCallback
) {
}
