package com.foliovault.flashloan;

import java.math.BigInteger;

/**
 * Borrower code run between disbursement and repayment verification, inside the loan's transition.
 * Anything it does is rolled back together with the loan if verification fails.
 */
@FunctionalInterface
public interface FlashLoanReceiver {

    FlashLoanReceiver NONE = (borrower, amount, fee) -> {
    };

    void onFlashLoan(String borrower, BigInteger amount, BigInteger fee);
}
