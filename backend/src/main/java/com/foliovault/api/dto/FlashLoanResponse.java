package com.foliovault.api.dto;

import com.foliovault.flashloan.FlashLoanReceipt;

import java.math.BigInteger;

public record FlashLoanResponse(String borrower, BigInteger amount, BigInteger fee, String phase) {

    public static FlashLoanResponse from(FlashLoanReceipt receipt) {
        return new FlashLoanResponse(receipt.borrower(), receipt.amount(), receipt.fee(), receipt.phase().name());
    }
}
