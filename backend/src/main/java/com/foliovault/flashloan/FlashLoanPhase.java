package com.foliovault.flashloan;

public enum FlashLoanPhase {
    /** Principal moved from custody to the borrower. */
    DISBURSED,
    /** Borrower balance checked against principal plus fee after the callback. */
    REPAYMENT_VERIFIED
}
